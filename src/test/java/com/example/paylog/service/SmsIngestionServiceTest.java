package com.example.paylog.service;

import com.example.paylog.config.RocksDBConfig;
import com.example.paylog.config.RocksDBService;
import com.example.paylog.config.SyncRetryProperties;
import com.example.paylog.exception.LocalStoreException;
import com.example.paylog.extraction.AccountIdentifierExtractor;
import com.example.paylog.extraction.AmountExtractor;
import com.example.paylog.extraction.DateTimeNormalizer;
import com.example.paylog.extraction.FinancialContextDetector;
import com.example.paylog.extraction.TransactionAssembler;
import com.example.paylog.extraction.TransactionTypeClassifier;
import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.ProcessingResult;
import com.example.paylog.model.ProcessingStatus;
import com.example.paylog.model.RawMessage;
import com.example.paylog.model.TransactionType;
import com.example.paylog.sync.SyncQueueManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SmsIngestionServiceTest {

    // 14:30:45 on 2024-12-18 in Asia/Kolkata
    private static final Instant NOW = Instant.parse("2024-12-18T09:00:45Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneId.of("Asia/Kolkata"));

    private static final String SCENARIO_ONE =
            "Your account XXXXXX1234 has been debited with Rs.1,500.00 on 15-Dec-2024";

    @TempDir
    Path dataDir;

    private RocksDBConfig rocksDBConfig;
    private RocksDBService rocksDBService;
    private LocalTransactionStore localStore;
    private RemoteTransactionStore remoteStore;
    private DuplicateDetector duplicateDetector;
    private SyncQueueManager syncQueueManager;
    private PipelineEventBus eventBus;
    private PipelineStatistics statistics;
    private final AtomicBoolean online = new AtomicBoolean(true);
    private SmsIngestionService service;

    @BeforeEach
    void setUp() {
        rocksDBConfig = RocksDBConfig.atPath(dataDir.toString());
        rocksDBService = new RocksDBService(rocksDBConfig);
        localStore = new LocalTransactionStore(rocksDBService, new ObjectMapper().findAndRegisterModules());
        remoteStore = mock(RemoteTransactionStore.class);

        duplicateDetector = new DuplicateDetector(rocksDBService, CLOCK, 90, 0);
        duplicateDetector.initialize();

        statistics = new PipelineStatistics();
        eventBus = new PipelineEventBus(64, List.of(statistics));
        eventBus.start();

        syncQueueManager = new SyncQueueManager(localStore, remoteStore, online::get, new SyncRetryProperties(),
                millis -> { }, eventBus, CLOCK, 0);

        service = newService(duplicateDetector);
    }

    private SmsIngestionService newService(DuplicateDetector detector) {
        TransactionAssembler assembler = new TransactionAssembler(new FinancialContextDetector(), new AmountExtractor(),
                new TransactionTypeClassifier(), new AccountIdentifierExtractor(), new DateTimeNormalizer("Asia/Kolkata"));

        SmsIngestionService ingestion = new SmsIngestionService(new FinancialContextDetector(), assembler,
                new TransactionValidator(CLOCK), detector, syncQueueManager, eventBus, statistics, CLOCK);
        ingestion.start();
        return ingestion;
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        syncQueueManager.shutdown();
        eventBus.stop();
        duplicateDetector.shutdown();
        rocksDBConfig.cleanup();
    }

    private static RawMessage sms(String content) {
        return RawMessage.of("VM-HDFCBK", content, NOW.minusSeconds(60));
    }

    @Test
    void bankDebitIsPersistedAndSynced() {
        ProcessingResult result = service.process(sms(SCENARIO_ONE), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.SYNCED);
        assertThat(result.getErrors()).isEmpty();
        String id = result.getTransactionId().orElseThrow();

        PersistedTransaction stored = localStore.findById(id).orElseThrow();
        assertThat(stored.getAmount()).isEqualByComparingTo("1500.00");
        assertThat(stored.getType()).isEqualTo(TransactionType.DEBIT);
        assertThat(stored.getAccountRef()).isEqualTo("xxxxxx1234");
        assertThat(stored.getDate()).isEqualTo("2024-12-15");
        assertThat(stored.getOwnerId()).isEqualTo("alice");
        assertThat(stored.isSynced()).isTrue();
        assertThat(stored.isManualEntry()).isFalse();
        assertThat(duplicateDetector.isDuplicate(result.getDedupHash())).isTrue();
        verify(remoteStore).upsert(any(PersistedTransaction.class));
    }

    @Test
    void secondDeliveryOfSameMessageIsDuplicate() {
        RawMessage message = sms(SCENARIO_ONE);

        ProcessingResult first = service.process(message, "alice", false);
        ProcessingResult second = service.process(message, "alice", false);

        assertThat(first.getStatus()).isEqualTo(ProcessingStatus.SYNCED);
        assertThat(second.getStatus()).isEqualTo(ProcessingStatus.DUPLICATE);
        assertThat(second.getDedupHash()).isEqualTo(first.getDedupHash());
        assertThat(localStore.findByOwner("alice")).hasSize(1);
    }

    @Test
    void concurrentIdenticalSubmissionsPersistOnce() throws Exception {
        RawMessage message = sms(SCENARIO_ONE);
        List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(service.submitRawMessage(message, "alice", false));
        }

        int persisted = 0;
        int duplicates = 0;
        for (CompletableFuture<ProcessingResult> future : futures) {
            ProcessingStatus status = future.get(10, TimeUnit.SECONDS).getStatus();
            if (status.isPersisted()) {
                persisted++;
            } else if (status == ProcessingStatus.DUPLICATE) {
                duplicates++;
            }
        }

        assertThat(persisted).isEqualTo(1);
        assertThat(duplicates).isEqualTo(7);
        assertThat(localStore.findAll()).hasSize(1);
    }

    @Test
    void emptyAndWhitespaceContentRejectedBeforeExtraction() {
        assertThat(service.process(sms(""), "alice", false).getStatus()).isEqualTo(ProcessingStatus.REJECTED_EMPTY);
        assertThat(service.process(sms("   \n "), "alice", false).getStatus()).isEqualTo(ProcessingStatus.REJECTED_EMPTY);
        assertThat(duplicateDetector.count()).isZero();
        assertThat(localStore.findAll()).isEmpty();
    }

    @Test
    void malformedMessagesRejected() {
        ProcessingResult blankSender = service.process(
                RawMessage.of("  ", "Rs.500 debited", NOW), "alice", false);
        ProcessingResult controlChars = service.process(sms("Rs.500 debited\u0007"), "alice", false);

        assertThat(blankSender.getStatus()).isEqualTo(ProcessingStatus.REJECTED_MALFORMED);
        assertThat(blankSender.getErrors()).containsExactly("sender is blank");
        assertThat(controlChars.getStatus()).isEqualTo(ProcessingStatus.REJECTED_MALFORMED);
    }

    @Test
    void nonFinancialMessageIgnored() {
        ProcessingResult result = service.process(sms("See you at the movies tonight"), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.NOT_FINANCIAL);
        assertThat(result.getTransactionId()).isEmpty();
        verify(remoteStore, never()).upsert(any(PersistedTransaction.class));
    }

    @Test
    void financialMessageWithoutAmountIsParseFailure() {
        ProcessingResult result = service.process(sms("Your account statement is ready"), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PARSE_FAILED);
        assertThat(localStore.findAll()).isEmpty();
    }

    @Test
    void validationFailureNeitherPersistsNorMarksHash() {
        ProcessingResult result = service.process(
                sms("Rs.500 debited from A/c XX1234 on 01-01-2020"), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.VALIDATION_FAILED);
        assertThat(result.getErrors()).containsExactly("Date is more than 90 days old: 2020-01-01");
        assertThat(duplicateDetector.isDuplicate(result.getDedupHash())).isFalse();
        assertThat(localStore.findAll()).isEmpty();
    }

    @Test
    void offlineRemoteQueuesRecord() {
        online.set(false);

        ProcessingResult result = service.process(sms(SCENARIO_ONE), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.QUEUED);
        String id = result.getTransactionId().orElseThrow();
        assertThat(localStore.findById(id)).hasValueSatisfying(t -> assertThat(t.isSynced()).isFalse());
        assertThat(syncQueueManager.queueSize()).isEqualTo(1);
        assertThat(duplicateDetector.isDuplicate(result.getDedupHash())).isTrue();

        online.set(true);
        syncQueueManager.drainQueueNow();

        assertThat(localStore.findById(id)).hasValueSatisfying(t -> assertThat(t.isSynced()).isTrue());
        verify(remoteStore, times(1)).upsert(any(PersistedTransaction.class));
    }

    @Test
    void manualEntryUsesManualSenderAndFlag() throws Exception {
        ProcessingResult result = service.submitManualEntry("Rs.250 paid to Swiggy today", null, "bob")
                .get(10, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.SYNCED);
        PersistedTransaction stored = localStore.findById(result.getTransactionId().orElseThrow()).orElseThrow();
        assertThat(stored.isManualEntry()).isTrue();
        assertThat(stored.getSenderId()).isEqualTo(SmsIngestionService.MANUAL_SENDER);
        assertThat(stored.getOwnerId()).isEqualTo("bob");
        assertThat(stored.getDate()).isEqualTo("2024-12-18");
    }

    @Test
    void defaultOwnerWhenNoneGiven() throws Exception {
        ProcessingResult result = service.submitRawMessage(sms(SCENARIO_ONE)).get(10, TimeUnit.SECONDS);

        PersistedTransaction stored = localStore.findById(result.getTransactionId().orElseThrow()).orElseThrow();
        assertThat(stored.getOwnerId()).isEqualTo(service.getDefaultOwnerId());
    }

    @Test
    void stoppedIntakeRefusesMessages() throws Exception {
        service.stopIntake();

        ProcessingResult refused = service.submitRawMessage(sms(SCENARIO_ONE)).get(10, TimeUnit.SECONDS);
        assertThat(refused.getStatus()).isEqualTo(ProcessingStatus.INTAKE_STOPPED);
        assertThat(service.isIntakeEnabled()).isFalse();

        service.startIntake();
        assertThat(service.submitRawMessage(sms(SCENARIO_ONE)).get(10, TimeUnit.SECONDS).getStatus())
                .isEqualTo(ProcessingStatus.SYNCED);
    }

    @Test
    void dedupWriteFailureStillDeliversAndBlocksRedelivery() {
        RocksDBService failingDedupWrite = spy(rocksDBService);
        doThrow(new LocalStoreException("dedup write failed", null))
                .doCallRealMethod()
                .when(failingDedupWrite).put(eq(RocksDBConfig.DEDUP_DB), anyString(), anyString());
        DuplicateDetector flaky = new DuplicateDetector(failingDedupWrite, CLOCK, 90, 0);
        flaky.initialize();
        SmsIngestionService flakyService = newService(flaky);
        RawMessage message = sms(SCENARIO_ONE);
        try {
            ProcessingResult first = flakyService.process(message, "alice", false);
            ProcessingResult second = flakyService.process(message, "alice", false);

            assertThat(first.getStatus()).isEqualTo(ProcessingStatus.SYNCED);
            assertThat(first.getWarnings()).anyMatch(w -> w.startsWith("dedup hash not persisted"));
            assertThat(localStore.findById(first.getTransactionId().orElseThrow()))
                    .hasValueSatisfying(t -> assertThat(t.isSynced()).isTrue());
            assertThat(second.getStatus()).isEqualTo(ProcessingStatus.DUPLICATE);
            assertThat(localStore.findAll()).hasSize(1);
            assertThat(flaky.isPersisted(first.getDedupHash())).isFalse();

            flakyService.recoverUnfinished();

            assertThat(flaky.isPersisted(first.getDedupHash())).isTrue();
        } finally {
            flakyService.shutdown();
            flaky.shutdown();
        }
    }

    @Test
    void unexpectedDeliveryFailureIsRequeuedOnRecovery() {
        doThrow(new IllegalStateException("driver failure"))
                .doNothing()
                .when(remoteStore).upsert(any(PersistedTransaction.class));

        ProcessingResult result = service.process(sms(SCENARIO_ONE), "alice", false);

        assertThat(result.getStatus()).isEqualTo(ProcessingStatus.ERROR);
        String id = result.getTransactionId().orElseThrow();
        assertThat(duplicateDetector.isDuplicate(result.getDedupHash())).isTrue();
        assertThat(syncQueueManager.queueSize()).isZero();

        assertThat(service.recoverUnfinished()).isEqualTo(1);
        assertThat(syncQueueManager.queueSize()).isEqualTo(1);
        assertThat(service.recoverUnfinished()).isZero();

        syncQueueManager.drainQueueNow();

        assertThat(localStore.findById(id)).hasValueSatisfying(t -> assertThat(t.isSynced()).isTrue());
        assertThat(service.process(sms(SCENARIO_ONE), "alice", false).getStatus()).isEqualTo(ProcessingStatus.DUPLICATE);
    }

    @Test
    void recoveryRestoresMissingDedupHashOfStoredRecord() {
        PersistedTransaction leftover = PersistedTransaction.builder()
                .id("left-1")
                .ownerId("alice")
                .amount(new BigDecimal("750.00"))
                .type(TransactionType.CREDIT)
                .date("2024-12-17")
                .time("10:00:00")
                .sourceText("Rs.750 credited")
                .senderId("VM-HDFCBK")
                .confidence(0.55)
                .createdAt(NOW)
                .dedupHash("leftover-hash")
                .build();
        localStore.save(leftover);
        localStore.save(leftover.toBuilder()
                .id("purged-1")
                .createdAt(NOW.minus(Duration.ofDays(120)))
                .dedupHash("purged-hash")
                .synced(true)
                .build());

        assertThat(service.recoverUnfinished()).isEqualTo(1);

        assertThat(duplicateDetector.isPersisted("leftover-hash")).isTrue();
        assertThat(duplicateDetector.isDuplicate("purged-hash")).isFalse();
        assertThat(syncQueueManager.queuedEntries()).hasSize(1);
        assertThat(syncQueueManager.queuedEntries().get(0).getTransactionId()).isEqualTo("left-1");
    }
}
