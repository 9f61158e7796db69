package com.example.paylog.extraction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * An amount candidate together with the text span it was read from.
 */
@Value
public class AmountMatch {
    BigDecimal value;
    int start;
    int end;
}
