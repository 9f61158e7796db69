package com.example.paylog.service;

import com.example.paylog.exception.LocalStoreException;
import com.example.paylog.extraction.FinancialContextDetector;
import com.example.paylog.extraction.TransactionAssembler;
import com.example.paylog.model.ExtractedTransaction;
import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.PipelineEvent;
import com.example.paylog.model.ProcessingResult;
import com.example.paylog.model.ProcessingStatus;
import com.example.paylog.model.RawMessage;
import com.example.paylog.model.SyncState;
import com.example.paylog.model.ValidationResult;
import com.example.paylog.sync.SyncQueueManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the pipeline: sanity gate, detection, duplicate claim, extraction, validation,
 * local persistence, hash marking and delivery. Each message is an independent unit of work on
 * the worker pool; identical messages are serialized by the duplicate detector's claim.
 */
@Slf4j
@Service
public class SmsIngestionService {

    public static final String MANUAL_SENDER = "MANUAL";

    private final FinancialContextDetector detector;
    private final TransactionAssembler assembler;
    private final TransactionValidator validator;
    private final DuplicateDetector duplicateDetector;
    private final SyncQueueManager syncQueueManager;
    private final PipelineEventBus eventBus;
    private final PipelineStatistics statistics;
    private final Clock clock;

    @Value("${paylog.owner-id:local-user}")
    private String defaultOwnerId = "local-user";

    @Value("${paylog.ingestion.worker-threads:4}")
    private int workerThreads = 4;

    @Value("${paylog.ingestion.max-content-length:2000}")
    private int maxContentLength = 2000;

    private ExecutorService workers;
    private final AtomicBoolean intakeEnabled = new AtomicBoolean(true);

    public SmsIngestionService(FinancialContextDetector detector,
                               TransactionAssembler assembler,
                               TransactionValidator validator,
                               DuplicateDetector duplicateDetector,
                               SyncQueueManager syncQueueManager,
                               PipelineEventBus eventBus,
                               PipelineStatistics statistics,
                               Clock clock) {
        this.detector = detector;
        this.assembler = assembler;
        this.validator = validator;
        this.duplicateDetector = duplicateDetector;
        this.syncQueueManager = syncQueueManager;
        this.eventBus = eventBus;
        this.statistics = statistics;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        workers = Executors.newFixedThreadPool(workerThreads, new ThreadFactory() {
            private final AtomicInteger threadCount = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "sms-ingestion-" + threadCount.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        });
        log.info("SMS ingestion started with {} workers, default owner '{}'", workerThreads, defaultOwnerId);
    }

    @PreDestroy
    public void shutdown() {
        intakeEnabled.set(false);
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public CompletableFuture<ProcessingResult> submitRawMessage(RawMessage message) {
        return submitRawMessage(message, defaultOwnerId, false);
    }

    /**
     * Queues the message for processing. The future always completes normally; the outcome is
     * in the result's status.
     */
    public CompletableFuture<ProcessingResult> submitRawMessage(RawMessage message, String ownerId, boolean manualEntry) {
        if (!intakeEnabled.get()) {
            return CompletableFuture.completedFuture(ProcessingResult.of(ProcessingStatus.INTAKE_STOPPED));
        }
        statistics.recordReceived();
        String owner = ownerId == null || ownerId.trim().isEmpty() ? defaultOwnerId : ownerId;
        try {
            return CompletableFuture.supplyAsync(() -> process(message, owner, manualEntry), workers);
        } catch (RejectedExecutionException e) {
            log.warn("Ingestion workers shut down, refusing message from {}", message.getSender());
            return CompletableFuture.completedFuture(ProcessingResult.of(ProcessingStatus.INTAKE_STOPPED));
        }
    }

    /**
     * Pasted SMS text entered by the user; same pipeline, flagged as manual entry.
     */
    public CompletableFuture<ProcessingResult> submitManualEntry(String content, String sender, String ownerId) {
        String from = sender == null || sender.trim().isEmpty() ? MANUAL_SENDER : sender;
        RawMessage message = RawMessage.of(from, content == null ? "" : content, clock.instant());
        return submitRawMessage(message, ownerId, true);
    }

    /**
     * Runs the whole pipeline for one message on the calling thread.
     */
    public ProcessingResult process(RawMessage message, String ownerId, boolean manualEntry) {
        String content = message.getContent();
        if (content.trim().isEmpty()) {
            return ProcessingResult.of(ProcessingStatus.REJECTED_EMPTY);
        }
        Optional<String> malformed = malformedReason(message);
        if (malformed.isPresent()) {
            log.debug("Rejected message from '{}': {}", message.getSender(), malformed.get());
            return ProcessingResult.builder().status(ProcessingStatus.REJECTED_MALFORMED).error(malformed.get()).build();
        }

        if (!detector.isFinancial(content)) {
            eventBus.publish(PipelineEvent.nonFinancial(message.getSender()));
            return ProcessingResult.of(ProcessingStatus.NOT_FINANCIAL);
        }

        String hash = duplicateDetector.hash(message.getSender(), content, message.getReceivedAt());
        eventBus.publish(PipelineEvent.financialDetected(message.getSender(), hash));

        if (!duplicateDetector.tryClaim(hash)) {
            log.debug("Duplicate message from {} ({})", message.getSender(), hash);
            eventBus.publish(PipelineEvent.duplicate(message.getSender(), hash));
            return ProcessingResult.builder().status(ProcessingStatus.DUPLICATE).dedupHash(hash).build();
        }
        try {
            return extractAndPersist(message, ownerId, manualEntry, hash);
        } finally {
            duplicateDetector.release(hash);
        }
    }

    private ProcessingResult extractAndPersist(RawMessage message, String ownerId, boolean manualEntry, String hash) {
        Optional<ExtractedTransaction> extracted = assembler.assemble(message);
        if (extracted.isEmpty()) {
            log.info("Financial message from {} could not be parsed: {}", message.getSender(), abbreviate(message.getContent()));
            eventBus.publish(PipelineEvent.parseFailed(message.getSender(), hash, "no amount found"));
            return ProcessingResult.builder().status(ProcessingStatus.PARSE_FAILED).dedupHash(hash).build();
        }
        ExtractedTransaction transaction = extracted.get();
        eventBus.publish(PipelineEvent.parsed(message.getSender(), hash,
                transaction.getType().getValue() + " " + transaction.getAmount().toPlainString()));

        PersistedTransaction record = PersistedTransaction.from(transaction, UUID.randomUUID().toString(),
                ownerId, clock.instant(), hash, manualEntry);

        ValidationResult validation = validator.validate(record);
        if (!validation.isValid()) {
            log.warn("Validation failed for message from {}: {}", message.getSender(), validation.getErrors());
            eventBus.publish(PipelineEvent.validationFailed(message.getSender(), hash, validation.getErrors()));
            return ProcessingResult.builder()
                    .status(ProcessingStatus.VALIDATION_FAILED)
                    .dedupHash(hash)
                    .errors(validation.getErrors())
                    .warnings(validation.getWarnings())
                    .build();
        }

        PersistedTransaction saved;
        try {
            saved = syncQueueManager.persistLocally(record);
        } catch (LocalStoreException e) {
            log.error("Local persistence failed for message from {}", message.getSender(), e);
            eventBus.publish(PipelineEvent.error(message.getSender(), e.getMessage()));
            return ProcessingResult.builder().status(ProcessingStatus.ERROR).dedupHash(hash).error(e.getMessage()).build();
        }

        // the hash is kept in memory even when its store write fails, and the record is delivered either way
        String markFailure = null;
        try {
            duplicateDetector.markProcessed(hash);
        } catch (LocalStoreException e) {
            log.error("Could not persist dedup hash {} for transaction {}", hash, saved.getId(), e);
            markFailure = "dedup hash not persisted: " + e.getMessage();
        }

        try {
            SyncState state = syncQueueManager.deliver(saved);
            ProcessingStatus status = state == SyncState.REMOTE_CONFIRMED ? ProcessingStatus.SYNCED : ProcessingStatus.QUEUED;
            ProcessingResult.ProcessingResultBuilder result = ProcessingResult.builder()
                    .status(status)
                    .transactionId(saved.getId())
                    .dedupHash(hash)
                    .warnings(validation.getWarnings());
            if (markFailure != null) {
                result.warning(markFailure);
            }
            return result.build();
        } catch (RuntimeException e) {
            log.error("Delivery step failed for transaction {}; it is re-queued on the next startup", saved.getId(), e);
            eventBus.publish(PipelineEvent.error(message.getSender(), e.getMessage()));
            return ProcessingResult.builder()
                    .status(ProcessingStatus.ERROR)
                    .transactionId(saved.getId())
                    .dedupHash(hash)
                    .error(String.valueOf(e.getMessage()))
                    .build();
        }
    }

    /**
     * Repairs what an interrupted run can leave behind: dedup hashes of stored records (still inside
     * the dedup retention window) that never reached the dedup store, and unsynced records with no
     * queue entry.
     *
     * @return number of records put back on the retry queue
     */
    public int recoverUnfinished() {
        int remarked = 0;
        Instant retainedSince = clock.instant().minus(duplicateDetector.getRetention());
        for (PersistedTransaction transaction : syncQueueManager.localTransactions()) {
            String hash = transaction.getDedupHash();
            boolean retained = transaction.getCreatedAt() == null || transaction.getCreatedAt().isAfter(retainedSince);
            if (hash != null && retained && !duplicateDetector.isPersisted(hash)) {
                duplicateDetector.markProcessed(hash);
                remarked++;
            }
        }
        int requeued = syncQueueManager.requeueUnsynced();
        if (remarked > 0 || requeued > 0) {
            log.warn("Recovered {} dedup hash(es) and re-queued {} unsynced transaction(s)", remarked, requeued);
        }
        return requeued;
    }

    private Optional<String> malformedReason(RawMessage message) {
        if (message.getSender().trim().isEmpty()) {
            return Optional.of("sender is blank");
        }
        if (message.getContent().length() > maxContentLength) {
            return Optional.of("content longer than " + maxContentLength + " characters");
        }
        for (char c : message.getContent().toCharArray()) {
            if (Character.isISOControl(c) && c != '\t' && c != '\n' && c != '\r') {
                return Optional.of("content contains control characters");
            }
        }
        return Optional.empty();
    }

    public void stopIntake() {
        if (intakeEnabled.compareAndSet(true, false)) {
            log.info("Message intake stopped");
        }
    }

    public void startIntake() {
        if (intakeEnabled.compareAndSet(false, true)) {
            log.info("Message intake started");
        }
    }

    public boolean isIntakeEnabled() {
        return intakeEnabled.get();
    }

    public String getDefaultOwnerId() {
        return defaultOwnerId;
    }

    private static String abbreviate(String content) {
        return content.length() > 50 ? content.substring(0, 50) + "..." : content;
    }
}
