package com.example.paylog.service;

import com.example.paylog.config.RocksDBConfig;
import com.example.paylog.config.RocksDBService;
import com.example.paylog.exception.LocalStoreException;
import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.QueueEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable local copy of every persisted transaction plus the retry queue, both as JSON in RocksDB.
 */
@Slf4j
@Service
public class LocalTransactionStore {

    private final RocksDBService rocksDBService;
    private final ObjectMapper objectMapper;

    public LocalTransactionStore(RocksDBService rocksDBService, ObjectMapper objectMapper) {
        this.rocksDBService = rocksDBService;
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the record. A record already confirmed remotely stays {@code synced=true}.
     */
    public synchronized PersistedTransaction save(PersistedTransaction transaction) {
        PersistedTransaction toWrite = transaction;
        if (!transaction.isSynced()) {
            Optional<PersistedTransaction> existing = findById(transaction.getId());
            if (existing.isPresent() && existing.get().isSynced()) {
                toWrite = transaction.toBuilder().synced(true).build();
            }
        }
        rocksDBService.put(RocksDBConfig.TRANSACTIONS_DB, toWrite.getId(), toJson(toWrite));
        return toWrite;
    }

    public synchronized void markSynced(String id) {
        findById(id).ifPresent(t -> {
            if (!t.isSynced()) {
                t.setSynced(true);
                rocksDBService.put(RocksDBConfig.TRANSACTIONS_DB, id, toJson(t));
            }
        });
    }

    public Optional<PersistedTransaction> findById(String id) {
        String json = rocksDBService.get(RocksDBConfig.TRANSACTIONS_DB, id);
        return json == null ? Optional.empty() : Optional.of(fromJson(json, PersistedTransaction.class));
    }

    /**
     * Records of one owner, newest first.
     */
    public List<PersistedTransaction> findByOwner(String ownerId) {
        return findAll().stream()
                .filter(t -> ownerId.equals(t.getOwnerId()))
                .sorted(Comparator.comparing(PersistedTransaction::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    public List<PersistedTransaction> findAll() {
        List<PersistedTransaction> all = new ArrayList<>();
        for (String json : rocksDBService.entries(RocksDBConfig.TRANSACTIONS_DB).values()) {
            all.add(fromJson(json, PersistedTransaction.class));
        }
        return all;
    }

    public void putQueueEntry(QueueEntry entry) {
        rocksDBService.put(RocksDBConfig.SYNC_QUEUE_DB, entry.getTransactionId(), toJson(entry));
    }

    public Optional<QueueEntry> findQueueEntry(String transactionId) {
        String json = rocksDBService.get(RocksDBConfig.SYNC_QUEUE_DB, transactionId);
        return json == null ? Optional.empty() : Optional.of(fromJson(json, QueueEntry.class));
    }

    /**
     * Queue contents, oldest first.
     */
    public List<QueueEntry> queueEntries() {
        List<QueueEntry> entries = new ArrayList<>();
        for (String json : rocksDBService.entries(RocksDBConfig.SYNC_QUEUE_DB).values()) {
            entries.add(fromJson(json, QueueEntry.class));
        }
        entries.sort(Comparator.comparing(QueueEntry::getEnqueuedAt));
        return entries;
    }

    public void removeFromQueue(String transactionId) {
        rocksDBService.delete(RocksDBConfig.SYNC_QUEUE_DB, transactionId);
    }

    public int queueSize() {
        return rocksDBService.entries(RocksDBConfig.SYNC_QUEUE_DB).size();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LocalStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new LocalStoreException("Corrupt " + type.getSimpleName() + " record in local store", e);
        }
    }
}
