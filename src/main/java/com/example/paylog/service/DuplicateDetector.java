package com.example.paylog.service;

import com.example.paylog.config.RocksDBConfig;
import com.example.paylog.config.RocksDBService;
import com.example.paylog.model.DedupRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Remembers which messages were already turned into transactions.
 * <p>
 * Hashes live in the {@code dedup} RocksDB store (hash to processed-at epoch millis) and are
 * mirrored in memory for lookups. Concurrent deliveries of the same message are serialized
 * through {@link #tryClaim(String)}: only one caller holds a given hash at a time.
 */
@Slf4j
@Service
public class DuplicateDetector {

    private final RocksDBService rocksDBService;
    private final Clock clock;
    private final Duration retention;
    private final long purgeIntervalMinutes;

    private final ConcurrentHashMap<String, Instant> processed = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean initialized;
    private ScheduledExecutorService purgeExecutor;

    public DuplicateDetector(RocksDBService rocksDBService,
                             Clock clock,
                             @Value("${paylog.dedup.retention-days:90}") long retentionDays,
                             @Value("${paylog.dedup.purge-interval-minutes:1440}") long purgeIntervalMinutes) {
        this.rocksDBService = rocksDBService;
        this.clock = clock;
        this.retention = Duration.ofDays(retentionDays);
        this.purgeIntervalMinutes = purgeIntervalMinutes;
    }

    /**
     * Loads persisted hashes into memory and starts the periodic purge.
     */
    @PostConstruct
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        int loaded = 0;
        for (Map.Entry<String, String> entry : rocksDBService.entries(RocksDBConfig.DEDUP_DB).entrySet()) {
            processed.put(entry.getKey(), Instant.ofEpochMilli(Long.parseLong(entry.getValue())));
            loaded++;
        }
        initialized = true;

        if (purgeIntervalMinutes > 0) {
            purgeExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "dedup-purge");
                t.setDaemon(true);
                return t;
            });
            purgeExecutor.scheduleAtFixedRate(this::purgeExpired, purgeIntervalMinutes, purgeIntervalMinutes, TimeUnit.MINUTES);
        }
        log.info("Duplicate detector initialized with {} known hashes, retention {} days", loaded, retention.toDays());
    }

    @PreDestroy
    public void shutdown() {
        if (purgeExecutor != null) {
            purgeExecutor.shutdownNow();
        }
    }

    /**
     * SHA-256 over the length-prefixed sender and content followed by the receipt epoch millis,
     * hex encoded. The length prefixes keep field boundaries unambiguous.
     */
    public String hash(String sender, String content, Instant receivedAt) {
        String material = sender.length() + ":" + sender + "|" + content.length() + ":" + content + "|" + receivedAt.toEpochMilli();
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(material.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isDuplicate(String hash) {
        ensureInitialized();
        return processed.containsKey(hash);
    }

    /**
     * Records the hash. Marking an already known hash keeps its original timestamp.
     * <p>
     * The in-memory entry is made before the store write, so a failed write still blocks
     * redeliveries for the life of this process; the write is retried by the next
     * {@code markProcessed} of the same hash.
     */
    public void markProcessed(String hash) {
        ensureInitialized();
        Instant now = clock.instant();
        Instant previous = processed.putIfAbsent(hash, now);
        Instant at = previous == null ? now : previous;
        if (previous == null || !isPersisted(hash)) {
            rocksDBService.put(RocksDBConfig.DEDUP_DB, hash, Long.toString(at.toEpochMilli()));
        }
    }

    /**
     * Whether the hash is in the {@code dedup} store, not just in memory.
     */
    public boolean isPersisted(String hash) {
        return rocksDBService.contains(RocksDBConfig.DEDUP_DB, hash);
    }

    /**
     * Takes exclusive ownership of {@code hash} for the duration of one message's processing.
     *
     * @return false if the hash is already processed or another caller holds it
     */
    public boolean tryClaim(String hash) {
        ensureInitialized();
        if (processed.containsKey(hash)) {
            return false;
        }
        if (!inFlight.add(hash)) {
            return false;
        }
        // marked between the first check and the claim
        if (processed.containsKey(hash)) {
            inFlight.remove(hash);
            return false;
        }
        return true;
    }

    public void release(String hash) {
        inFlight.remove(hash);
    }

    /**
     * Drops hashes processed before {@code now - age}.
     *
     * @return number of hashes removed
     */
    public int purgeOlderThan(Duration age) {
        ensureInitialized();
        Instant cutoff = clock.instant().minus(age);
        int removed = 0;
        for (Map.Entry<String, Instant> entry : processed.entrySet()) {
            if (entry.getValue().isBefore(cutoff)) {
                rocksDBService.delete(RocksDBConfig.DEDUP_DB, entry.getKey());
                processed.remove(entry.getKey(), entry.getValue());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} dedup hashes older than {}", removed, cutoff);
        }
        return removed;
    }

    public Optional<DedupRecord> find(String hash) {
        ensureInitialized();
        Instant at = processed.get(hash);
        return at == null ? Optional.empty() : Optional.of(new DedupRecord(hash, at));
    }

    public Optional<Instant> processedAt(String hash) {
        return find(hash).map(DedupRecord::getProcessedAt);
    }

    /**
     * Forgets a hash so the same message can be ingested again.
     */
    public boolean remove(String hash) {
        ensureInitialized();
        if (processed.remove(hash) == null) {
            return false;
        }
        rocksDBService.delete(RocksDBConfig.DEDUP_DB, hash);
        return true;
    }

    public int count() {
        ensureInitialized();
        return processed.size();
    }

    public Duration getRetention() {
        return retention;
    }

    public boolean isInitialized() {
        return initialized;
    }

    private void purgeExpired() {
        try {
            purgeOlderThan(retention);
        } catch (RuntimeException e) {
            log.error("Scheduled dedup purge failed", e);
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Duplicate detector used before initialize()");
        }
    }
}
