package com.example.paylog.exception;

import com.example.paylog.model.FailureClass;

/**
 * A remote write failed. {@link FailureClass#TRANSIENT} failures are worth retrying,
 * {@link FailureClass#PERMANENT} ones need someone to fix the data or the permissions first.
 */
public class RemoteStoreException extends RuntimeException {
    private final FailureClass failureClass;

    public RemoteStoreException(FailureClass failureClass, String message, Throwable cause) {
        super(message, cause);
        this.failureClass = failureClass;
    }

    public FailureClass getFailureClass() {
        return failureClass;
    }

    public boolean isTransient() {
        return failureClass == FailureClass.TRANSIENT;
    }
}
