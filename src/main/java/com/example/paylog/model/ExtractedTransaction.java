package com.example.paylog.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Structured result of running the extractors over one financial message.
 */
@Value
@Builder
public class ExtractedTransaction {
    BigDecimal amount;
    TransactionType type;

    @Getter(AccessLevel.NONE)
    String accountRef;

    /** ISO-8601 calendar date, {@code YYYY-MM-DD}. */
    String date;

    /** 24-hour {@code HH:MM:SS}. */
    String time;

    String sourceText;
    String senderId;
    double confidence;

    public Optional<String> getAccountRef() {
        return Optional.ofNullable(accountRef);
    }
}
