package com.example.paylog.sync;

import lombok.Value;

/**
 * Outcome of one pass over the retry queue.
 */
@Value
public class DrainReport {
    boolean executed;
    String reason;
    int attempted;
    int confirmed;
    int failed;
    int skippedPermanent;
    int remaining;

    static DrainReport notExecuted(String reason, int remaining) {
        return new DrainReport(false, reason, 0, 0, 0, 0, remaining);
    }
}
