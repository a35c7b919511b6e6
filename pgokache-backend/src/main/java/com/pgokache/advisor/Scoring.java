package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.Confidence;

/**
 * Score and confidence helpers shared by the rules.
 */
final class Scoring {
    static final double MAX_SCORE = 100.0;

    private Scoring() {
    }

    /**
     * Log-scaled workload score in [0, 100], relative to the heaviest query of the same run.
     * Non-decreasing in {@code workload} for a fixed {@code maxWorkload}.
     *
     * @param workload total time times calls of the query
     * @param maxWorkload largest workload of the run
     * @return score rounded to one decimal
     */
    static double workloadScore(double workload, double maxWorkload) {
        if (workload <= 0 || maxWorkload <= 0) {
            return 0;
        }
        double ratio = Math.log1p(workload) / Math.log1p(Math.max(workload, maxWorkload));
        return round(Math.min(MAX_SCORE, MAX_SCORE * ratio));
    }

    static Confidence byCallsAndRatio(long calls, double ratio, double highRatio, PgOkacheProperties.Advisor t) {
        if (calls >= t.getHighConfidenceCalls() && ratio >= highRatio) {
            return Confidence.HIGH;
        }
        if (calls >= t.getMediumConfidenceCalls() || ratio >= highRatio) {
            return Confidence.MEDIUM;
        }
        return Confidence.LOW;
    }

    static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
