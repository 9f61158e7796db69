package com.example.paylog.extraction;

import lombok.Value;

/**
 * Normalized date and time plus whether each was read from the text or taken from the fallback.
 */
@Value
public class DateTimeResult {
    String date;
    String time;
    boolean dateExplicit;
    boolean timeExplicit;
}
