package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.Confidence;
import com.pgokache.model.QueryStat;
import com.pgokache.model.RecommendationType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TempSpillRuleTest {

    private final TempSpillRule rule = new TempSpillRule();

    private static RuleContext context(PgOkacheProperties.Advisor thresholds, QueryStat... stats) {
        List<EffectiveStat> effective = Arrays.stream(stats)
                .map(s -> new EffectiveStat(s, EffectiveStat.Basis.ABSOLUTE))
                .toList();
        return new RuleContext(1L, effective, thresholds);
    }

    // 500 temp blocks per call: five times the default spill threshold.
    private static QueryStat spillingSort() {
        return QueryStat.builder()
                .queryId("9")
                .queryNorm("SELECT * FROM events ORDER BY created_at")
                .calls(2000)
                .totalTimeMs(60_000)
                .meanTimeMs(30)
                .rows(2_000_000)
                .tempBlksWritten(1_000_000)
                .build();
    }

    @Test
    void spillBelowTheHighConfidenceRatioIsMedium() {
        List<RecommendationCandidate> out = rule.evaluate(context(new PgOkacheProperties.Advisor(), spillingSort()));

        assertThat(out).singleElement().satisfies(c -> {
            assertThat(c.getType()).isEqualTo(RecommendationType.WORK_MEM);
            assertThat(c.getConfidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(c.getEvidence()).isEqualTo(500.0);
        });
    }

    @Test
    void highConfidenceRatioIsConfigurable() {
        PgOkacheProperties.Advisor thresholds = new PgOkacheProperties.Advisor();
        thresholds.setTempSpillHighConfidenceRatio(4);

        List<RecommendationCandidate> out = rule.evaluate(context(thresholds, spillingSort()));

        assertThat(out).singleElement()
                .extracting(RecommendationCandidate::getConfidence)
                .isEqualTo(Confidence.HIGH);
    }

    @Test
    void smallSpillsAreIgnored() {
        QueryStat light = spillingSort().toBuilder().tempBlksWritten(2000).build();

        assertThat(rule.evaluate(context(new PgOkacheProperties.Advisor(), light))).isEmpty();
    }
}
