package com.pgokache.advisor;

import com.pgokache.model.QueryStat;
import lombok.Value;

/**
 * Statistics a rule reasons over: either the interval between two snapshots or, when no usable
 * previous capture exists, the absolute counters of the latest one.
 */
@Value
public class EffectiveStat {

    public enum Basis {
        /** No earlier capture of this query. */
        ABSOLUTE,
        /** Difference between the two latest snapshots. */
        DELTA,
        /** Counters went backwards (stats reset); absolute values of the latest snapshot. */
        RESET
    }

    QueryStat stat;
    Basis basis;

    public String describeBasis() {
        switch (basis) {
            case DELTA:
                return "Measured between the last two snapshots.";
            case RESET:
                return "Statistics were reset since the previous snapshot; using counters accumulated since the reset.";
            default:
                return "Based on cumulative counters since the last statistics reset.";
        }
    }
}
