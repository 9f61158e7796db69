package com.example.paylog.service;

import com.example.paylog.model.PipelineEvent;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters fed by lifecycle events. Received messages are counted by the ingestion service.
 */
@Component
public class PipelineStatistics implements PipelineEventListener {

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong financial = new AtomicLong();
    private final AtomicLong parsed = new AtomicLong();
    private final AtomicLong validationFailed = new AtomicLong();
    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong synced = new AtomicLong();
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public void recordReceived() {
        received.incrementAndGet();
    }

    @Override
    public void onEvent(PipelineEvent event) {
        switch (event.getType()) {
            case FINANCIAL_MESSAGE_DETECTED:
                financial.incrementAndGet();
                break;
            case PARSED:
                parsed.incrementAndGet();
                break;
            case VALIDATION_FAILED:
                validationFailed.incrementAndGet();
                break;
            case PERSISTED:
                persisted.incrementAndGet();
                break;
            case SYNC_COMPLETED:
                synced.incrementAndGet();
                break;
            case QUEUED:
                queued.incrementAndGet();
                break;
            case DUPLICATE_DETECTED:
                duplicates.incrementAndGet();
                break;
            case ERROR:
                errors.incrementAndGet();
                break;
            default:
                break;
        }
    }

    public Snapshot snapshot() {
        long parsedCount = parsed.get();
        long failed = validationFailed.get();
        return new Snapshot(received.get(), financial.get(), parsedCount, Math.max(0, parsedCount - failed),
                failed, persisted.get(), synced.get(), queued.get(), duplicates.get(), errors.get());
    }

    public void reset() {
        received.set(0);
        financial.set(0);
        parsed.set(0);
        validationFailed.set(0);
        persisted.set(0);
        synced.set(0);
        queued.set(0);
        duplicates.set(0);
        errors.set(0);
    }

    @Value
    public static class Snapshot {
        long received;
        long financial;
        long parsed;
        long validationPassed;
        long validationFailed;
        long persisted;
        long synced;
        long queued;
        long duplicates;
        long errors;
    }
}
