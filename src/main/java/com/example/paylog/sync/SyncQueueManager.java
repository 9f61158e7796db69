package com.example.paylog.sync;

import com.example.paylog.config.SyncRetryProperties;
import com.example.paylog.exception.RemoteStoreException;
import com.example.paylog.model.FailureClass;
import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.PipelineEvent;
import com.example.paylog.model.QueueEntry;
import com.example.paylog.model.SyncState;
import com.example.paylog.service.ConnectivityMonitor;
import com.example.paylog.service.LocalTransactionStore;
import com.example.paylog.service.PipelineEventBus;
import com.example.paylog.service.RemoteTransactionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves persisted transactions to the remote store.
 * <p>
 * A record is always written locally first. Delivery then makes up to
 * {@link SyncRetryProperties#getMaxAttempts()} attempts, backing off between transient failures and
 * stopping at the first permanent one. Records that are not confirmed land in the retry queue,
 * which a periodic (or explicit) drain works through while the remote store is reachable.
 * Permanently failed entries stay queued but are skipped until {@link #rearm(String)}.
 */
@Slf4j
@Service
public class SyncQueueManager {

    private final LocalTransactionStore localStore;
    private final RemoteTransactionStore remoteStore;
    private final ConnectivityMonitor connectivity;
    private final SyncRetryProperties retry;
    private final Sleeper sleeper;
    private final PipelineEventBus eventBus;
    private final Clock clock;
    private final long drainIntervalSeconds;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private ScheduledExecutorService drainScheduler;

    public SyncQueueManager(LocalTransactionStore localStore,
                            RemoteTransactionStore remoteStore,
                            ConnectivityMonitor connectivity,
                            SyncRetryProperties retry,
                            Sleeper sleeper,
                            PipelineEventBus eventBus,
                            Clock clock,
                            @Value("${paylog.sync.drain-interval-seconds:30}") long drainIntervalSeconds) {
        this.localStore = localStore;
        this.remoteStore = remoteStore;
        this.connectivity = connectivity;
        this.retry = retry;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
        this.clock = clock;
        this.drainIntervalSeconds = drainIntervalSeconds;
    }

    @PostConstruct
    public void startScheduler() {
        if (drainIntervalSeconds <= 0) {
            log.info("Periodic queue drain disabled");
            return;
        }
        drainScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-queue-drain");
            t.setDaemon(true);
            return t;
        });
        drainScheduler.scheduleWithFixedDelay(this::scheduledDrain, drainIntervalSeconds, drainIntervalSeconds, TimeUnit.SECONDS);
        log.info("Periodic queue drain every {}s", drainIntervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (drainScheduler != null) {
            drainScheduler.shutdown();
            try {
                if (!drainScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    drainScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                drainScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * CREATED to LOCALLY_PERSISTED. Must succeed before any remote attempt.
     */
    public PersistedTransaction persistLocally(PersistedTransaction transaction) {
        PersistedTransaction saved = localStore.save(transaction);
        eventBus.publish(PipelineEvent.persisted(saved.getId(), saved.getDedupHash()));
        log.debug("Transaction {} persisted locally", saved.getId());
        return saved;
    }

    /**
     * LOCALLY_PERSISTED to REMOTE_CONFIRMED, or QUEUED_FOR_RETRY when the remote store is
     * offline, keeps failing transiently, or rejects the record.
     */
    public SyncState deliver(PersistedTransaction transaction) {
        if (!connectivity.isReachable()) {
            enqueue(transaction, 0, FailureClass.TRANSIENT, "remote store unreachable");
            return SyncState.QUEUED_FOR_RETRY;
        }

        Attempt outcome = attemptWithRetry(transaction);
        if (outcome.success) {
            confirm(transaction.getId());
            return SyncState.REMOTE_CONFIRMED;
        }
        enqueue(transaction, outcome.attempts, outcome.failureClass, outcome.error);
        return SyncState.QUEUED_FOR_RETRY;
    }

    /**
     * Re-attempts every queued entry that is not permanently failed. Only one drain runs at a time.
     */
    public DrainReport drainQueueNow() {
        if (!draining.compareAndSet(false, true)) {
            return DrainReport.notExecuted("drain already in progress", localStore.queueSize());
        }
        try {
            if (!connectivity.isReachable()) {
                return DrainReport.notExecuted("remote store unreachable", localStore.queueSize());
            }

            int attempted = 0;
            int confirmed = 0;
            int failed = 0;
            int skipped = 0;
            for (QueueEntry entry : localStore.queueEntries()) {
                if (entry.isPermanentlyFailed()) {
                    skipped++;
                    continue;
                }
                attempted++;
                Attempt outcome;
                try {
                    outcome = attemptWithRetry(entry.getTransaction());
                } catch (RuntimeException e) {
                    log.error("Unexpected failure delivering queued transaction {}", entry.getTransactionId(), e);
                    outcome = Attempt.failed(1, FailureClass.TRANSIENT, String.valueOf(e.getMessage()));
                }
                if (outcome.success) {
                    localStore.removeFromQueue(entry.getTransactionId());
                    confirm(entry.getTransactionId());
                    confirmed++;
                } else {
                    entry.setAttempts(entry.getAttempts() + outcome.attempts);
                    entry.setFailureClass(outcome.failureClass);
                    entry.setLastError(outcome.error);
                    entry.setLastAttemptAt(clock.instant());
                    localStore.putQueueEntry(entry);
                    failed++;
                }
            }

            DrainReport report = new DrainReport(true, null, attempted, confirmed, failed, skipped, localStore.queueSize());
            if (attempted > 0 || skipped > 0) {
                log.info("Queue drain finished: attempted={}, confirmed={}, failed={}, skippedPermanent={}, remaining={}",
                        attempted, confirmed, failed, skipped, report.getRemaining());
            }
            return report;
        } finally {
            draining.set(false);
        }
    }

    /**
     * Clears a permanent failure so the next drain attempts the entry again.
     *
     * @return false if no entry is queued under {@code transactionId}
     */
    public boolean rearm(String transactionId) {
        Optional<QueueEntry> entry = localStore.findQueueEntry(transactionId);
        if (entry.isEmpty()) {
            return false;
        }
        QueueEntry queued = entry.get();
        queued.setFailureClass(null);
        localStore.putQueueEntry(queued);
        log.info("Queue entry {} re-armed after {} attempts", transactionId, queued.getAttempts());
        return true;
    }

    /**
     * Queues every locally stored record that is neither confirmed nor already queued.
     *
     * @return number of records queued
     */
    public int requeueUnsynced() {
        int requeued = 0;
        for (PersistedTransaction transaction : localStore.findAll()) {
            if (!transaction.isSynced() && localStore.findQueueEntry(transaction.getId()).isEmpty()) {
                enqueue(transaction, 0, FailureClass.TRANSIENT, "unsynced record without queue entry");
                requeued++;
            }
        }
        return requeued;
    }

    public List<PersistedTransaction> localTransactions() {
        return localStore.findAll();
    }

    public List<QueueEntry> queuedEntries() {
        return localStore.queueEntries();
    }

    public int queueSize() {
        return localStore.queueSize();
    }

    private void scheduledDrain() {
        try {
            if (localStore.queueSize() > 0) {
                drainQueueNow();
            }
        } catch (RuntimeException e) {
            log.error("Scheduled queue drain failed", e);
        }
    }

    private Attempt attemptWithRetry(PersistedTransaction transaction) {
        int maxAttempts = retry.getMaxAttempts();
        RemoteStoreException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    sleeper.sleep(retry.backoffBeforeAttempt(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Attempt.failed(attempt - 1, FailureClass.TRANSIENT, "interrupted during backoff");
                }
            }
            try {
                remoteStore.upsert(transaction);
                return Attempt.succeeded(attempt);
            } catch (RemoteStoreException e) {
                last = e;
                if (!e.isTransient()) {
                    log.warn("Permanent remote failure for {}: {}", transaction.getId(), e.getMessage());
                    return Attempt.failed(attempt, FailureClass.PERMANENT, e.getMessage());
                }
                log.warn("Transient remote failure for {} (attempt {}/{}): {}",
                        transaction.getId(), attempt, maxAttempts, e.getMessage());
            }
        }
        return Attempt.failed(maxAttempts, FailureClass.TRANSIENT, last != null ? last.getMessage() : null);
    }

    private void confirm(String transactionId) {
        localStore.markSynced(transactionId);
        eventBus.publish(PipelineEvent.syncCompleted(transactionId));
        log.debug("Transaction {} confirmed by remote store", transactionId);
    }

    private void enqueue(PersistedTransaction transaction, int attempts, FailureClass failureClass, String error) {
        QueueEntry entry = new QueueEntry(transaction, SyncState.QUEUED_FOR_RETRY, attempts, failureClass, error,
                clock.instant(), attempts > 0 ? clock.instant() : null);
        localStore.putQueueEntry(entry);
        eventBus.publish(PipelineEvent.queued(transaction.getId(), error));
        log.warn("Transaction {} queued for retry ({}): {}", transaction.getId(), failureClass, error);
    }

    private static final class Attempt {
        private final boolean success;
        private final int attempts;
        private final FailureClass failureClass;
        private final String error;

        private Attempt(boolean success, int attempts, FailureClass failureClass, String error) {
            this.success = success;
            this.attempts = attempts;
            this.failureClass = failureClass;
            this.error = error;
        }

        static Attempt succeeded(int attempts) {
            return new Attempt(true, attempts, null, null);
        }

        static Attempt failed(int attempts, FailureClass failureClass, String error) {
            return new Attempt(false, attempts, failureClass, error);
        }
    }
}
