package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.Confidence;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringTest {

    @Test
    void heaviestQueryScoresHundred() {
        assertThat(Scoring.workloadScore(2.5e7, 2.5e7)).isEqualTo(100.0);
    }

    @Test
    void scoreIsMonotonicInWorkloadAndBounded() {
        double max = 1e9;
        double previous = -1;
        for (double w = 1; w <= max; w *= 10) {
            double score = Scoring.workloadScore(w, max);
            assertThat(score).isBetween(0.0, 100.0).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void zeroWorkloadScoresZero() {
        assertThat(Scoring.workloadScore(0, 100)).isZero();
        assertThat(Scoring.workloadScore(10, 0)).isZero();
    }

    @Test
    void confidenceFollowsCallsAndRatio() {
        PgOkacheProperties.Advisor t = new PgOkacheProperties.Advisor();

        assertThat(Scoring.byCallsAndRatio(5000, 90_000, 1000, t)).isEqualTo(Confidence.HIGH);
        assertThat(Scoring.byCallsAndRatio(300, 150, 1000, t)).isEqualTo(Confidence.MEDIUM);
        assertThat(Scoring.byCallsAndRatio(60, 5000, 1000, t)).isEqualTo(Confidence.MEDIUM);
        assertThat(Scoring.byCallsAndRatio(60, 150, 1000, t)).isEqualTo(Confidence.LOW);
    }

    @Test
    void roundsToOneDecimal() {
        assertThat(Scoring.round(87.649)).isEqualTo(87.6);
        assertThat(Scoring.round(87.65)).isEqualTo(87.7);
    }
}
