package com.example.paylog.model;

/**
 * TRANSIENT failures heal on their own and are retried; PERMANENT ones need user action.
 */
public enum FailureClass {
    TRANSIENT,
    PERMANENT
}
