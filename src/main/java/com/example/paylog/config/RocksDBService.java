package com.example.paylog.config;

import com.example.paylog.exception.LocalStoreException;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String key/value access to the named RocksDB stores.
 */
@Service
@Slf4j
public class RocksDBService {
    private final RocksDBConfig config;

    public RocksDBService(RocksDBConfig config) {
        this.config = config;
    }

    public void put(String dbName, String key, String value) {
        try {
            config.getRocksDB(dbName).put(bytes(key), bytes(value));
        } catch (RocksDBException e) {
            throw new LocalStoreException("Failed to put key: " + key + " in " + dbName, e);
        }
    }

    public String get(String dbName, String key) {
        try {
            byte[] result = config.getRocksDB(dbName).get(bytes(key));
            return result != null ? new String(result, StandardCharsets.UTF_8) : null;
        } catch (RocksDBException e) {
            throw new LocalStoreException("Failed to get key: " + key + " from " + dbName, e);
        }
    }

    public boolean contains(String dbName, String key) {
        return get(dbName, key) != null;
    }

    public void delete(String dbName, String key) {
        try {
            config.getRocksDB(dbName).delete(bytes(key));
        } catch (RocksDBException e) {
            throw new LocalStoreException("Failed to delete key: " + key + " from " + dbName, e);
        }
    }

    /**
     * All entries of a store in key order.
     */
    public Map<String, String> entries(String dbName) {
        Map<String, String> entries = new LinkedHashMap<>();
        RocksDB db = config.getRocksDB(dbName);
        try (RocksIterator iterator = db.newIterator()) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                entries.put(new String(iterator.key(), StandardCharsets.UTF_8),
                        new String(iterator.value(), StandardCharsets.UTF_8));
                iterator.next();
            }
            iterator.status();
        } catch (RocksDBException e) {
            throw new LocalStoreException("Failed to scan store: " + dbName, e);
        }
        return entries;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
