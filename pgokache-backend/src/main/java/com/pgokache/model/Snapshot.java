package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Immutable capture of pg_stat_statements for one instance, rows ordered by total time descending.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Snapshot {
    long id;
    long instanceId;
    OffsetDateTime capturedAt;
    @Singular
    List<QueryStat> queryStats;

    @JsonIgnore
    public boolean isEmpty() {
        return queryStats == null || queryStats.isEmpty();
    }

    /**
     * Copy of this snapshot with only the first {@code limit} rows, for display.
     *
     * @param limit max rows
     * @return trimmed copy, or this snapshot when already small enough
     */
    public Snapshot limitedTo(int limit) {
        if (limit <= 0 || queryStats.size() <= limit) {
            return this;
        }
        return toBuilder().clearQueryStats().queryStats(queryStats.subList(0, limit)).build();
    }
}
