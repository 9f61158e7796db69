package com.example.paylog.service;

import com.example.paylog.exception.RemoteStoreException;
import com.example.paylog.model.PersistedTransaction;

import java.util.List;

/**
 * System of record the pipeline delivers to. Writes are keyed by record id and scoped by owner.
 */
public interface RemoteTransactionStore {

    /**
     * Inserts or replaces the record.
     *
     * @throws RemoteStoreException classified as transient or permanent
     */
    void upsert(PersistedTransaction transaction);

    List<PersistedTransaction> findByOwner(String ownerId);
}
