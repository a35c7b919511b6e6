package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import lombok.Value;

import java.util.List;

/**
 * Inputs shared by all rules for one engine run.
 */
@Value
public class RuleContext {
    long instanceId;
    List<EffectiveStat> stats;
    PgOkacheProperties.Advisor thresholds;

    /**
     * Largest {@code total_time_ms * calls} among the effective stats, the normalization base for scores.
     *
     * @return max workload, 0 when there are no stats
     */
    public double maxWorkload() {
        return stats.stream().mapToDouble(s -> s.getStat().workload()).max().orElse(0);
    }
}
