package com.example.paylog.service;

import com.example.paylog.exception.RemoteStoreException;
import com.example.paylog.mapper.PersistedTransactionMapper;
import com.example.paylog.model.FailureClass;
import com.example.paylog.model.PersistedTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Service;

import java.net.ConnectException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;

@Slf4j
@Service
public class MyBatisRemoteTransactionStore implements RemoteTransactionStore {

    private final PersistedTransactionMapper mapper;

    public MyBatisRemoteTransactionStore(PersistedTransactionMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void upsert(PersistedTransaction transaction) {
        PersistedTransaction row = transaction.toBuilder().synced(true).build();
        try {
            if (mapper.selectById(row.getId()) == null) {
                mapper.insert(row);
            } else {
                mapper.updateById(row);
            }
        } catch (DataAccessException e) {
            FailureClass failureClass = classify(e);
            throw new RemoteStoreException(failureClass,
                    "Remote write failed for " + transaction.getId() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    public List<PersistedTransaction> findByOwner(String ownerId) {
        try {
            return mapper.findByOwnerId(ownerId);
        } catch (DataAccessException e) {
            throw new RemoteStoreException(classify(e), "Remote read failed for owner " + ownerId, e);
        }
    }

    /**
     * Transient when anything in the cause chain says the store is unreachable, busy or timed out.
     */
    static FailureClass classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof DataAccessResourceFailureException
                    || t instanceof CannotGetJdbcConnectionException
                    || t instanceof QueryTimeoutException
                    || t instanceof SQLTransientException
                    || t instanceof SQLRecoverableException
                    || t instanceof ConnectException) {
                return FailureClass.TRANSIENT;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return FailureClass.PERMANENT;
    }
}
