package com.pgokache.service;

import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Read-only catalog and settings probes used by the setup checker and collector.
 */
@Component
public class PgCatalogReader {

    private static final String CURRENT_SETTING_SQL = "SELECT current_setting(?, true)";
    private static final String EXTENSION_AVAILABLE_SQL =
            "SELECT EXISTS (SELECT 1 FROM pg_available_extensions WHERE name = 'pg_stat_statements')";
    // pg_extension is per database, so this is scoped to the connected one.
    private static final String EXTENSION_CREATED_SQL =
            "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'pg_stat_statements')";
    private static final String HAS_VIEW_SQL =
            "SELECT to_regclass('pg_stat_statements') IS NOT NULL";

    /**
     * Read a server setting.
     *
     * @param target open target connection
     * @param name setting name, e.g. {@code server_version_num}
     * @return value, or null when the setting does not exist (e.g. extension not loaded)
     * @throws SQLException on failure, including 42501 for settings the role may not read
     */
    public String setting(TargetConnection target, String name) throws SQLException {
        try (PreparedStatement ps = target.getConnection().prepareStatement(CURRENT_SETTING_SQL)) {
            ps.setQueryTimeout(target.getQueryTimeoutSeconds());
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public boolean extensionAvailable(TargetConnection target) throws SQLException {
        return queryBoolean(target, EXTENSION_AVAILABLE_SQL);
    }

    public boolean extensionCreated(TargetConnection target) throws SQLException {
        return queryBoolean(target, EXTENSION_CREATED_SQL);
    }

    public boolean hasStatementsView(TargetConnection target) throws SQLException {
        return queryBoolean(target, HAS_VIEW_SQL);
    }

    private boolean queryBoolean(TargetConnection target, String sql) throws SQLException {
        try (PreparedStatement ps = target.getConnection().prepareStatement(sql)) {
            ps.setQueryTimeout(target.getQueryTimeoutSeconds());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
