package com.example.paylog.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Probes the remote store's {@link DataSource} with {@link Connection#isValid(int)}.
 */
@Slf4j
@Component
public class DataSourceConnectivityMonitor implements ConnectivityMonitor {

    private final DataSource dataSource;
    private final int timeoutSeconds;

    public DataSourceConnectivityMonitor(DataSource dataSource,
                                         @Value("${paylog.connectivity.validation-timeout-seconds:2}") int timeoutSeconds) {
        this.dataSource = dataSource;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean isReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(timeoutSeconds);
        } catch (SQLException e) {
            log.debug("Remote store unreachable: {}", e.getMessage());
            return false;
        }
    }
}
