package com.example.paylog.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry budget and backoff for remote writes. Documented in application.yml.
 * <p>
 * Attempts are numbered from 1. No pause precedes attempt 1; attempt {@code n > 1} waits
 * {@code baseDelayMs * 2^(n-2)}, capped at {@code maxDelayMs} and then spread by the jitter factor.
 */
@ConfigurationProperties(prefix = "paylog.sync.retry")
@NoArgsConstructor
@Getter
@Setter
public class SyncRetryProperties {

    /** Delay before the second attempt; doubles for each further attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Upper bound of a single pause before jitter. Default 60000. */
    private long maxDelayMs = 60_000L;

    /** Jitter factor 0..1. Default 0 (deterministic doubling). */
    private double jitterFactor = 0.0;

    /** Total attempts per delivery, the first one included. Default 3. */
    private int maxAttempts = 3;

    public SyncRetryProperties(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        setMaxAttempts(maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("paylog.sync.retry.max-attempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public long backoffBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0L;
        }
        int doublings = attempt - 2;
        long delay;
        if (doublings >= 62 || baseDelayMs > (maxDelayMs >> doublings)) {
            delay = maxDelayMs;
        } else {
            delay = Math.min(baseDelayMs << doublings, maxDelayMs);
        }
        if (jitterFactor <= 0.0) {
            return delay;
        }
        double spread = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, (long) (delay * spread));
    }
}
