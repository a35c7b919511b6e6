package com.pgokache.service;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One short-lived, read-only session against a monitored instance.
 *
 * <p>Owns a single-connection pool; closing this closes both the connection and the pool.
 */
@Slf4j
public class TargetConnection implements AutoCloseable {
    private final long instanceId;
    private final HikariDataSource dataSource;
    private final Connection connection;
    private final int queryTimeoutSeconds;

    public TargetConnection(long instanceId, HikariDataSource dataSource, Connection connection, int queryTimeoutSeconds) {
        this.instanceId = instanceId;
        this.dataSource = dataSource;
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public long getInstanceId() {
        return instanceId;
    }

    public Connection getConnection() {
        return connection;
    }

    /**
     * Timeout to apply to every statement via {@link java.sql.Statement#setQueryTimeout(int)}.
     *
     * @return seconds, at least 1
     */
    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    @Override
    public void close() {
        try {
            if (connection != null) {
                connection.close();
            }
        } catch (SQLException e) {
            log.debug("Closing target connection failed: instance_id={}, sql_state={}", instanceId, e.getSQLState());
        } finally {
            if (dataSource != null) {
                dataSource.close();
            }
        }
    }
}
