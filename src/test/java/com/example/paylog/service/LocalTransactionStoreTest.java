package com.example.paylog.service;

import com.example.paylog.config.RocksDBConfig;
import com.example.paylog.config.RocksDBService;
import com.example.paylog.model.FailureClass;
import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.QueueEntry;
import com.example.paylog.model.SyncState;
import com.example.paylog.model.TransactionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LocalTransactionStoreTest {

    private static final Instant T0 = Instant.parse("2024-12-18T09:00:00Z");

    @TempDir
    Path dataDir;

    private RocksDBConfig rocksDBConfig;
    private LocalTransactionStore store;

    @BeforeEach
    void setUp() {
        rocksDBConfig = RocksDBConfig.atPath(dataDir.toString());
        store = new LocalTransactionStore(new RocksDBService(rocksDBConfig), new ObjectMapper().findAndRegisterModules());
    }

    @AfterEach
    void tearDown() {
        rocksDBConfig.cleanup();
    }

    private static PersistedTransaction txn(String id, String owner, Instant createdAt) {
        return PersistedTransaction.builder()
                .id(id)
                .ownerId(owner)
                .amount(new BigDecimal("1500.00"))
                .type(TransactionType.DEBIT)
                .accountRef("xxxxxx1234")
                .date("2024-12-15")
                .time("14:30:45")
                .sourceText("Your account XXXXXX1234 has been debited with Rs.1,500.00")
                .senderId("VM-HDFCBK")
                .confidence(0.7)
                .createdAt(createdAt)
                .dedupHash("hash-" + id)
                .build();
    }

    @Test
    void savedRecordReadsBackUnchanged() {
        PersistedTransaction original = txn("t1", "alice", T0);

        store.save(original);

        assertThat(store.findById("t1")).hasValue(original);
        assertThat(store.findById("missing")).isEmpty();
    }

    @Test
    void syncedFlagNeverRegresses() {
        store.save(txn("t1", "alice", T0));
        store.markSynced("t1");

        PersistedTransaction resaved = store.save(txn("t1", "alice", T0));

        assertThat(resaved.isSynced()).isTrue();
        assertThat(store.findById("t1")).hasValueSatisfying(t -> assertThat(t.isSynced()).isTrue());
    }

    @Test
    void ownerRecordsNewestFirst() {
        store.save(txn("a", "alice", T0));
        store.save(txn("b", "alice", T0.plusSeconds(60)));
        store.save(txn("c", "bob", T0.plusSeconds(30)));

        assertThat(store.findByOwner("alice")).extracting(PersistedTransaction::getId).containsExactly("b", "a");
        assertThat(store.findByOwner("carol")).isEmpty();
        assertThat(store.findAll()).hasSize(3);
    }

    @Test
    void queueEntriesOrderedByEnqueueTime() {
        store.putQueueEntry(new QueueEntry(txn("late", "alice", T0), SyncState.QUEUED_FOR_RETRY, 3,
                FailureClass.TRANSIENT, "timeout", T0.plusSeconds(10), T0.plusSeconds(10)));
        store.putQueueEntry(new QueueEntry(txn("early", "alice", T0), SyncState.QUEUED_FOR_RETRY, 0,
                null, null, T0, null));

        assertThat(store.queueSize()).isEqualTo(2);
        assertThat(store.queueEntries()).extracting(QueueEntry::getTransactionId).containsExactly("early", "late");
        assertThat(store.findQueueEntry("late")).hasValueSatisfying(e -> {
            assertThat(e.getAttempts()).isEqualTo(3);
            assertThat(e.getFailureClass()).isEqualTo(FailureClass.TRANSIENT);
            assertThat(e.getLastError()).isEqualTo("timeout");
        });

        store.removeFromQueue("early");

        assertThat(store.queueSize()).isEqualTo(1);
        assertThat(store.findQueueEntry("early")).isEmpty();
    }
}
