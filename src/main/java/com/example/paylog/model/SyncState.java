package com.example.paylog.model;

/**
 * Delivery state of a record. {@link #REMOTE_CONFIRMED} is terminal.
 */
public enum SyncState {
    CREATED,
    LOCALLY_PERSISTED,
    QUEUED_FOR_RETRY,
    REMOTE_CONFIRMED
}
