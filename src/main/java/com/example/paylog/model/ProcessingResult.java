package com.example.paylog.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of pushing one message through the pipeline.
 */
@Value
@Builder
public class ProcessingResult {
    ProcessingStatus status;

    @Getter(AccessLevel.NONE)
    String transactionId;

    String dedupHash;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    public Optional<String> getTransactionId() {
        return Optional.ofNullable(transactionId);
    }

    public static ProcessingResult of(ProcessingStatus status) {
        return ProcessingResult.builder().status(status).build();
    }
}
