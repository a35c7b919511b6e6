package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.QueryStat;
import com.pgokache.model.RecommendationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags statements that read many shared blocks from outside the buffer cache per returned row,
 * the signature of sequential scans over large tables.
 */
@Component
public class MissingIndexRule implements RecommendationRule {

    @Override
    public String name() {
        return "missing_index";
    }

    @Override
    public List<RecommendationCandidate> evaluate(RuleContext context) {
        PgOkacheProperties.Advisor t = context.getThresholds();
        double maxWorkload = context.maxWorkload();
        List<RecommendationCandidate> out = new ArrayList<>();
        for (EffectiveStat effective : context.getStats()) {
            QueryStat stat = effective.getStat();
            if (!StatementKind.of(stat.getQueryNorm()).isIndexable()) {
                continue;
            }
            if (stat.getCalls() < t.getIndexMinCalls()) {
                continue;
            }
            double ratio = stat.readRatio();
            if (ratio < t.getIndexReadRatio()) {
                continue;
            }
            out.add(RecommendationCandidate.builder()
                    .type(RecommendationType.MISSING_INDEX)
                    .queryId(stat.getQueryId())
                    .title("Index opportunity for query " + stat.getQueryId())
                    .details(String.format(Locale.ROOT,
                            "Reads %.0f shared blocks from disk per returned row over %d calls "
                                    + "(%.1f ms total, %.1f ms mean), which points at sequential scans. "
                                    + "Index the filter and join columns. %s",
                            ratio, stat.getCalls(), stat.getTotalTimeMs(), stat.getMeanTimeMs(),
                            effective.describeBasis()))
                    .sql(IndexSuggestion.forQuery(stat.getQueryNorm()))
                    .confidence(Scoring.byCallsAndRatio(stat.getCalls(), ratio, t.getHighConfidenceReadRatio(), t))
                    .score(Scoring.workloadScore(stat.workload(), maxWorkload))
                    .evidence(stat.readsPerCall())
                    .build());
        }
        return out;
    }
}
