package com.example.paylog.service;

/**
 * Whether the remote store can currently be reached.
 */
public interface ConnectivityMonitor {
    boolean isReachable();
}
