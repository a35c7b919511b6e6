package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Cumulative statistics of one normalized statement at capture time.
 *
 * <p>All counters are totals since the last {@code pg_stat_statements_reset()}, not deltas.
 * {@code queryId} is kept as text: the server value is a signed 64-bit hash and must round-trip
 * through JSON clients without precision loss.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryStat {
    @JsonProperty("queryid")
    String queryId;
    String queryNorm;
    long calls;
    double totalTimeMs;
    double meanTimeMs;
    long rows;
    long sharedBlksHit;
    long sharedBlksRead;
    long tempBlksWritten;
    long walBytes;

    /**
     * Total time multiplied by calls, the workload measure used for ranking.
     *
     * @return workload
     */
    public double workload() {
        return totalTimeMs * calls;
    }

    /**
     * Shared blocks read from outside the buffer cache per returned row.
     *
     * @return read ratio, rows floored at one
     */
    public double readRatio() {
        return (double) sharedBlksRead / Math.max(rows, 1L);
    }

    /**
     * Shared blocks read from outside the buffer cache per call. Unlike {@link #workload()} this
     * does not grow with the length of the measured interval.
     *
     * @return blocks per call, 0 when there were no calls
     */
    public double readsPerCall() {
        return calls > 0 ? (double) sharedBlksRead / calls : 0;
    }

    /**
     * Temporary blocks written per call.
     *
     * @return blocks per call, 0 when there were no calls
     */
    public double tempBlocksPerCall() {
        return calls > 0 ? (double) tempBlksWritten / calls : 0;
    }
}
