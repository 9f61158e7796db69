package com.example.paylog.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Lifecycle notification published on the event ring buffer. Slots are reused, so
 * consumers must not keep a reference past {@code onEvent}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineEvent {
    public enum Type {
        FINANCIAL_MESSAGE_DETECTED,
        NON_FINANCIAL_MESSAGE,
        PARSED,
        PARSE_FAILED,
        VALIDATION_FAILED,
        DUPLICATE_DETECTED,
        PERSISTED,
        QUEUED,
        SYNC_COMPLETED,
        ERROR
    }

    private Type type;
    private String sender;
    private String dedupHash;
    private String transactionId;
    private String detail;
    private List<String> errors;
    private long eventTime;

    public void copyFrom(PipelineEvent other) {
        this.type = other.type;
        this.sender = other.sender;
        this.dedupHash = other.dedupHash;
        this.transactionId = other.transactionId;
        this.detail = other.detail;
        this.errors = other.errors;
        this.eventTime = other.eventTime;
    }

    public static PipelineEvent financialDetected(String sender, String hash) {
        return new PipelineEvent(Type.FINANCIAL_MESSAGE_DETECTED, sender, hash, null, null, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent nonFinancial(String sender) {
        return new PipelineEvent(Type.NON_FINANCIAL_MESSAGE, sender, null, null, null, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent parsed(String sender, String hash, String detail) {
        return new PipelineEvent(Type.PARSED, sender, hash, null, detail, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent parseFailed(String sender, String hash, String reason) {
        return new PipelineEvent(Type.PARSE_FAILED, sender, hash, null, reason, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent validationFailed(String sender, String hash, List<String> errors) {
        return new PipelineEvent(Type.VALIDATION_FAILED, sender, hash, null, null, List.copyOf(errors), System.currentTimeMillis());
    }

    public static PipelineEvent duplicate(String sender, String hash) {
        return new PipelineEvent(Type.DUPLICATE_DETECTED, sender, hash, null, null, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent persisted(String transactionId, String hash) {
        return new PipelineEvent(Type.PERSISTED, null, hash, transactionId, null, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent queued(String transactionId, String reason) {
        return new PipelineEvent(Type.QUEUED, null, null, transactionId, reason, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent syncCompleted(String transactionId) {
        return new PipelineEvent(Type.SYNC_COMPLETED, null, null, transactionId, null, List.of(), System.currentTimeMillis());
    }

    public static PipelineEvent error(String sender, String message) {
        return new PipelineEvent(Type.ERROR, sender, null, null, message, List.of(), System.currentTimeMillis());
    }
}
