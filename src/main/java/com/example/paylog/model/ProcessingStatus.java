package com.example.paylog.model;

public enum ProcessingStatus {
    REJECTED_EMPTY,
    REJECTED_MALFORMED,
    INTAKE_STOPPED,
    NOT_FINANCIAL,
    DUPLICATE,
    PARSE_FAILED,
    VALIDATION_FAILED,
    SYNCED,
    QUEUED,
    ERROR;

    /** True when a record was persisted locally for this message. */
    public boolean isPersisted() {
        return this == SYNCED || this == QUEUED;
    }
}
