package com.example.paylog.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Opens one RocksDB instance per logical store under {@code paylog.rocksdb.path}.
 */
@Configuration
@Slf4j
public class RocksDBConfig {

    public static final String TRANSACTIONS_DB = "transactions";
    public static final String SYNC_QUEUE_DB = "sync-queue";
    public static final String DEDUP_DB = "dedup";

    private final String rocksdbPath;
    private final boolean createIfMissing;
    private final int maxOpenFiles;
    private final long writeBufferSize;
    private final int maxWriteBufferNumber;

    private final ConcurrentMap<String, RocksDB> rocksDBInstances = new ConcurrentHashMap<>();

    static {
        RocksDB.loadLibrary();
    }

    public RocksDBConfig(@Value("${paylog.rocksdb.path:./rocksdb_data}") String rocksdbPath,
                         @Value("${paylog.rocksdb.options.create-if-missing:true}") boolean createIfMissing,
                         @Value("${paylog.rocksdb.options.max-open-files:1000}") int maxOpenFiles,
                         @Value("${paylog.rocksdb.options.write-buffer-size:67108864}") long writeBufferSize,
                         @Value("${paylog.rocksdb.options.max-write-buffer-number:3}") int maxWriteBufferNumber) {
        this.rocksdbPath = rocksdbPath;
        this.createIfMissing = createIfMissing;
        this.maxOpenFiles = maxOpenFiles;
        this.writeBufferSize = writeBufferSize;
        this.maxWriteBufferNumber = maxWriteBufferNumber;
    }

    /**
     * Standalone instance with default tuning, used outside the Spring context.
     */
    public static RocksDBConfig atPath(String rocksdbPath) {
        return new RocksDBConfig(rocksdbPath, true, 1000, 8L * 1024 * 1024, 3);
    }

    /**
     * Get or open the named store.
     */
    public RocksDB getRocksDB(String dbName) {
        return rocksDBInstances.computeIfAbsent(dbName, name -> {
            try {
                String dbPath = rocksdbPath + File.separator + name;
                new File(dbPath).mkdirs();
                RocksDB db = RocksDB.open(createRocksDBOptions(), dbPath);
                log.info("RocksDB opened successfully at path: {}", dbPath);
                return db;
            } catch (RocksDBException e) {
                log.error("Failed to open RocksDB at path: {}/{}", rocksdbPath, name, e);
                throw new IllegalStateException("Failed to initialize RocksDB store " + name, e);
            }
        });
    }

    private Options createRocksDBOptions() {
        Options options = new Options();

        options.setCreateIfMissing(createIfMissing);
        options.setMaxOpenFiles(maxOpenFiles);
        options.setWriteBufferSize(writeBufferSize);
        options.setMaxWriteBufferNumber(maxWriteBufferNumber);

        options.setCompressionType(CompressionType.LZ4_COMPRESSION);
        options.setBottommostCompressionType(CompressionType.ZSTD_COMPRESSION);

        options.setIncreaseParallelism(Runtime.getRuntime().availableProcessors());
        options.setAllowConcurrentMemtableWrite(true);
        options.setEnableWriteThreadAdaptiveYield(true);

        options.setInfoLogLevel(InfoLogLevel.WARN_LEVEL);

        return options;
    }

    @PreDestroy
    public void cleanup() {
        rocksDBInstances.forEach((name, db) -> {
            try {
                db.close();
                log.info("RocksDB instance '{}' closed successfully", name);
            } catch (Exception e) {
                log.error("Error closing RocksDB instance '{}'", name, e);
            }
        });
        rocksDBInstances.clear();
    }
}
