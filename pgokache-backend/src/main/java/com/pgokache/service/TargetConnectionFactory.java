package com.pgokache.service;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.util.JdbcUrls;
import com.pgokache.util.SqlErrorClassifier;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;

/**
 * Opens read-only sessions against monitored instances with bounded connect and query timeouts.
 *
 * <p>Every attempt gets its own one-connection Hikari pool which fails fast on the first
 * connection error instead of retrying until the pool timeout.
 */
@Slf4j
@Component
public class TargetConnectionFactory {
    private static final int MIN_HIKARI_CONNECTION_TIMEOUT_MS = 250;

    private final PgOkacheProperties.Target settings;

    public TargetConnectionFactory(PgOkacheProperties properties) {
        this.settings = properties.getTarget();
    }

    /**
     * Connect to an instance.
     *
     * @param descriptor connection descriptor (password is used and not retained)
     * @return open connection, to be closed by the caller
     * @throws com.pgokache.error.TargetAccessException classified connection failure
     */
    public TargetConnection open(ConnectionDescriptor descriptor) {
        HikariConfig config = buildHikariConfig(descriptor);
        HikariDataSource ds = null;
        try {
            ds = new HikariDataSource(config);
            Connection conn = ds.getConnection();
            log.debug("Connected to instance: instance_id={}, pool={}", descriptor.getInstanceId(), config.getPoolName());
            return new TargetConnection(descriptor.getInstanceId(), ds, conn, queryTimeoutSeconds());
        } catch (Exception e) {
            if (ds != null) {
                ds.close();
            }
            log.warn("Connection to instance failed: instance_id={}, host={}, port={}, sql_state={}",
                    descriptor.getInstanceId(), descriptor.getHost(), descriptor.getPort(),
                    SqlErrorClassifier.sqlStateOf(e));
            throw SqlErrorClassifier.classify(e, "connecting to " + descriptor.getHost() + ":" + descriptor.getPort());
        }
    }

    HikariConfig buildHikariConfig(ConnectionDescriptor descriptor) {
        HikariConfig config = new HikariConfig();
        config.setDriverClassName("org.postgresql.Driver");
        config.setJdbcUrl(JdbcUrls.postgres(descriptor));
        config.setUsername(descriptor.getUser());
        config.setPassword(descriptor.getPassword());
        config.setReadOnly(true);
        config.setAutoCommit(true);

        // Shows up as pg_stat_activity.application_name on the target.
        config.addDataSourceProperty("ApplicationName", settings.getApplicationName());
        if (descriptor.getSslMode() != null && !descriptor.getSslMode().isBlank()) {
            config.addDataSourceProperty("sslmode", descriptor.getSslMode());
        }
        config.addDataSourceProperty("connectTimeout", String.valueOf(toSeconds(settings.getConnectTimeoutMs())));
        // Socket timeout is a backstop behind Statement#setQueryTimeout.
        config.addDataSourceProperty("socketTimeout", String.valueOf(queryTimeoutSeconds() + 5));

        config.setConnectionTimeout(Math.max(MIN_HIKARI_CONNECTION_TIMEOUT_MS, settings.getConnectTimeoutMs()));
        config.setInitializationFailTimeout(1);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(0);
        config.setPoolName("Target-" + descriptor.getInstanceId() + "-" + System.currentTimeMillis());
        return config;
    }

    int queryTimeoutSeconds() {
        return toSeconds(settings.getQueryTimeoutMs());
    }

    private static int toSeconds(int millis) {
        return Math.max(1, (int) Math.ceil(millis / 1000.0));
    }
}
