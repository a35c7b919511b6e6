package com.pgokache.util;

import com.pgokache.error.ErrorKind;
import com.pgokache.error.TargetAccessException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps JDBC / HikariCP failures against a monitored instance to an {@link ErrorKind}.
 *
 * <p>Hikari wraps driver failures (PoolInitializationException, SQLTransientConnectionException),
 * so the whole cause chain, including {@link SQLException#getNextException()}, is inspected and
 * the first SQLState found wins.
 */
public final class SqlErrorClassifier {

    private SqlErrorClassifier() {
    }

    /**
     * Classify a failure and wrap it.
     *
     * @param e failure
     * @param action what was being done, e.g. "connecting" or "reading pg_stat_statements"
     * @return classified exception carrying an operator facing sentence
     */
    public static TargetAccessException classify(Throwable e, String action) {
        ErrorKind kind = kindOf(e);
        return new TargetAccessException(kind, describe(kind, action, sqlStateOf(e)), e);
    }

    /**
     * Classify a failure.
     *
     * @param e failure
     * @return error kind
     */
    public static ErrorKind kindOf(Throwable e) {
        if (e instanceof TargetAccessException tae) {
            return tae.getKind();
        }
        String sqlState = sqlStateOf(e);
        if (sqlState != null) {
            ErrorKind kind = kindOfSqlState(sqlState);
            if (kind != null) {
                return kind;
            }
        }
        if (hasNetworkCause(e)) {
            return ErrorKind.CONNECTION_ERROR;
        }
        return ErrorKind.INTERNAL_ERROR;
    }

    static ErrorKind kindOfSqlState(String sqlState) {
        if (sqlState.startsWith("28")) {
            return ErrorKind.AUTH_ERROR;
        }
        if ("42501".equals(sqlState)) {
            return ErrorKind.PERMISSION_ERROR;
        }
        if ("42P01".equals(sqlState) || "55000".equals(sqlState) || "42704".equals(sqlState)) {
            // undefined view, library not preloaded, unknown setting
            return ErrorKind.NOT_READY;
        }
        if ("57014".equals(sqlState) || sqlState.startsWith("08") || sqlState.startsWith("53")
                || sqlState.startsWith("57P") || "3D000".equals(sqlState)) {
            return ErrorKind.CONNECTION_ERROR;
        }
        return null;
    }

    /**
     * First SQLState found in the cause chain.
     *
     * @param e failure
     * @return SQLState, or null when none is present
     */
    public static String sqlStateOf(Throwable e) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = e;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (current instanceof SQLException sql) {
                if (sql.getSQLState() != null && !sql.getSQLState().isBlank()) {
                    return sql.getSQLState();
                }
                SQLException next = sql.getNextException();
                if (next != null && next.getSQLState() != null && !next.getSQLState().isBlank()) {
                    return next.getSQLState();
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static boolean hasNetworkCause(Throwable e) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = e;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || current instanceof UnknownHostException
                    || current instanceof SQLTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(ErrorKind kind, String action, String sqlState) {
        String suffix = sqlState != null ? " (SQLState " + sqlState + ")." : ".";
        return switch (kind) {
            case AUTH_ERROR -> "The instance rejected the saved credentials while " + action + suffix;
            case PERMISSION_ERROR -> "The role lacks privileges for " + action
                    + "; grant pg_read_all_stats or connect as a superuser" + suffix;
            case NOT_READY -> "pg_stat_statements is not installed or not preloaded, failed while " + action + suffix;
            case CONNECTION_ERROR -> "The instance could not be reached or timed out while " + action + suffix;
            default -> "Unexpected failure while " + action + suffix;
        };
    }
}
