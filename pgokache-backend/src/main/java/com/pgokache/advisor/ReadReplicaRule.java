package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.Confidence;
import com.pgokache.model.QueryStat;
import com.pgokache.model.RecommendationType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Instance-level rule: suggests a read replica when SELECT statements dominate total execution
 * time across the captured top statements.
 */
@Component
public class ReadReplicaRule implements RecommendationRule {

    @Override
    public String name() {
        return "read_replica";
    }

    @Override
    public List<RecommendationCandidate> evaluate(RuleContext context) {
        PgOkacheProperties.Advisor t = context.getThresholds();
        double totalTime = 0;
        double readTime = 0;
        long readCalls = 0;
        for (EffectiveStat effective : context.getStats()) {
            QueryStat stat = effective.getStat();
            totalTime += stat.getTotalTimeMs();
            if (StatementKind.of(stat.getQueryNorm()).isRead()) {
                readTime += stat.getTotalTimeMs();
                readCalls += stat.getCalls();
            }
        }
        if (totalTime <= 0 || totalTime < t.getReplicaMinTotalTimeMs()) {
            return List.of();
        }
        double share = readTime / totalTime;
        if (share < t.getReplicaReadShare()) {
            return List.of();
        }

        Confidence confidence = share >= t.getReplicaHighReadShare() && readCalls >= t.getReplicaHighReadCalls()
                ? Confidence.HIGH
                : Confidence.MEDIUM;
        return List.of(RecommendationCandidate.builder()
                .type(RecommendationType.READ_REPLICA)
                .title("Read-heavy workload detected")
                .details(String.format(Locale.ROOT,
                        "%.0f%% of total query time (%.0f of %.0f ms, %d calls) comes from SELECT statements. "
                                + "A read replica can absorb reporting and analytics traffic.",
                        share * 100, readTime, totalTime, readCalls))
                .sql("")
                .confidence(confidence)
                .score(Scoring.round(share * Scoring.MAX_SCORE))
                .evidence(share)
                .build());
    }
}
