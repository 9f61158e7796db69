package com.example.paylog.service;

import com.example.paylog.exception.TransactionNotFoundException;
import com.example.paylog.model.PersistedTransaction;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read model over the local store, which holds every record whether or not it reached the remote store.
 */
@Service
public class TransactionQueryService {

    private final LocalTransactionStore localStore;

    public TransactionQueryService(LocalTransactionStore localStore) {
        this.localStore = localStore;
    }

    public List<PersistedTransaction> findByOwner(String ownerId) {
        return localStore.findByOwner(ownerId);
    }

    public PersistedTransaction getById(String id) {
        return localStore.findById(id).orElseThrow(() -> new TransactionNotFoundException(id));
    }
}
