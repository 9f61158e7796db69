package com.example.paylog.exception;

/**
 * The embedded store could not read or write a record.
 */
public class LocalStoreException extends RuntimeException {
    public LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
