package com.pgokache.collector;

import com.pgokache.model.QueryStat;
import com.pgokache.service.TargetConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the top statements of the connected database from pg_stat_statements.
 *
 * <p>Returns raw rows; redaction and filtering happen in {@link SnapshotCollector}.
 */
@Slf4j
@Component
public class PgStatStatementsReader {

    /** First major version with total_exec_time / mean_exec_time and wal_bytes. */
    static final int EXEC_TIME_COLUMNS_SINCE = 13;

    /**
     * Build the statistics query for a server version.
     *
     * <p>The view holds one entry per user, database, queryid and top-level flag; entries are
     * summed per queryid so every statement appears once.
     *
     * @param majorVersion server major version, null when unknown
     * @return SQL with one limit parameter
     */
    static String buildSql(Integer majorVersion) {
        boolean modern = majorVersion == null || majorVersion >= EXEC_TIME_COLUMNS_SINCE;
        String total = "SUM(" + (modern ? "s.total_exec_time" : "s.total_time") + ")";
        String wal = modern ? "COALESCE(SUM(s.wal_bytes), 0)" : "0";
        return "SELECT s.queryid::text AS queryid, MIN(s.query) AS query, "
                + "COALESCE(SUM(s.calls), 0) AS calls, "
                + "COALESCE(" + total + ", 0) AS total_time, "
                + "COALESCE(" + total + " / NULLIF(SUM(s.calls), 0), 0) AS mean_time, "
                + "COALESCE(SUM(s.rows), 0) AS rows, "
                + "COALESCE(SUM(s.shared_blks_hit), 0) AS shared_blks_hit, "
                + "COALESCE(SUM(s.shared_blks_read), 0) AS shared_blks_read, "
                + "COALESCE(SUM(s.temp_blks_written), 0) AS temp_blks_written, "
                + wal + " AS wal_bytes "
                + "FROM pg_stat_statements s "
                + "WHERE s.dbid = (SELECT oid FROM pg_database WHERE datname = current_database()) "
                + "GROUP BY s.queryid "
                + "ORDER BY " + total + " DESC NULLS LAST "
                + "LIMIT ?";
    }

    /**
     * Fetch up to {@code limit} rows ordered by total execution time.
     *
     * @param target open connection
     * @param majorVersion server major version
     * @param limit row cap
     * @return rows in server order, fully materialized
     * @throws SQLException on any failure; no partial result is returned
     */
    public List<QueryStat> read(TargetConnection target, Integer majorVersion, int limit) throws SQLException {
        List<QueryStat> rows = new ArrayList<>();
        int hidden = 0;
        try (PreparedStatement ps = target.getConnection().prepareStatement(buildSql(majorVersion))) {
            ps.setQueryTimeout(target.getQueryTimeoutSeconds());
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String queryId = rs.getString("queryid");
                    if (queryId == null) {
                        // Statements of other roles show up without id unless pg_read_all_stats is granted.
                        hidden++;
                        continue;
                    }
                    rows.add(QueryStat.builder()
                            .queryId(queryId)
                            .queryNorm(rs.getString("query"))
                            .calls(rs.getLong("calls"))
                            .totalTimeMs(rs.getDouble("total_time"))
                            .meanTimeMs(rs.getDouble("mean_time"))
                            .rows(rs.getLong("rows"))
                            .sharedBlksHit(rs.getLong("shared_blks_hit"))
                            .sharedBlksRead(rs.getLong("shared_blks_read"))
                            .tempBlksWritten(rs.getLong("temp_blks_written"))
                            .walBytes(toLong(rs.getBigDecimal("wal_bytes")))
                            .build());
                }
            }
        }
        if (hidden > 0) {
            log.info("Skipped {} pg_stat_statements groups without queryid (insufficient privilege): instance_id={}",
                    hidden, target.getInstanceId());
        }
        return rows;
    }

    private static long toLong(BigDecimal value) {
        return value != null ? value.longValue() : 0L;
    }
}
