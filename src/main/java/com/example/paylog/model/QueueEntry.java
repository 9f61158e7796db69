package com.example.paylog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A locally persisted transaction waiting for remote delivery.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueEntry {
    private PersistedTransaction transaction;
    private SyncState state;
    private int attempts;
    private FailureClass failureClass;
    private String lastError;
    private Instant enqueuedAt;
    private Instant lastAttemptAt;

    @JsonIgnore
    public String getTransactionId() {
        return transaction.getId();
    }

    @JsonIgnore
    public boolean isPermanentlyFailed() {
        return failureClass == FailureClass.PERMANENT;
    }
}
