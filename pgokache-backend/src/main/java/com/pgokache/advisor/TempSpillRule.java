package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.QueryStat;
import com.pgokache.model.RecommendationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags statements that write temporary blocks on most calls, i.e. sorts or hashes spilling to disk.
 *
 * <p>When the statement also reads heavily from disk the spill is reported as an index
 * opportunity (an index can deliver rows pre-sorted); otherwise as a work_mem hint.
 */
@Component
public class TempSpillRule implements RecommendationRule {
    static final long BLOCK_BYTES = 8192;
    static final long MIN_WORK_MEM_MB = 8;
    static final long MAX_WORK_MEM_MB = 1024;

    @Override
    public String name() {
        return "temp_spill";
    }

    @Override
    public List<RecommendationCandidate> evaluate(RuleContext context) {
        PgOkacheProperties.Advisor t = context.getThresholds();
        double maxWorkload = context.maxWorkload();
        List<RecommendationCandidate> out = new ArrayList<>();
        for (EffectiveStat effective : context.getStats()) {
            QueryStat stat = effective.getStat();
            if (stat.getCalls() < t.getIndexMinCalls() || stat.getTempBlksWritten() <= 0) {
                continue;
            }
            double tempPerCall = stat.tempBlocksPerCall();
            if (tempPerCall < t.getTempBlocksPerCall()) {
                continue;
            }

            boolean readHeavy = StatementKind.of(stat.getQueryNorm()).isIndexable()
                    && stat.readRatio() >= t.getIndexReadRatio();
            double spillRatio = tempPerCall / t.getTempBlocksPerCall();
            RecommendationCandidate.RecommendationCandidateBuilder candidate = RecommendationCandidate.builder()
                    .queryId(stat.getQueryId())
                    .confidence(Scoring.byCallsAndRatio(stat.getCalls(), spillRatio, t.getTempSpillHighConfidenceRatio(), t))
                    .score(Scoring.workloadScore(stat.workload(), maxWorkload));

            String spill = String.format(Locale.ROOT,
                    "Writes %.0f temporary blocks (%.1f MB) per call over %d calls, so sorts or hashes spill to disk.",
                    tempPerCall, tempPerCall * BLOCK_BYTES / (1024.0 * 1024.0), stat.getCalls());
            if (readHeavy) {
                out.add(candidate
                        .type(RecommendationType.MISSING_INDEX)
                        .evidence(stat.readsPerCall())
                        .title("Index opportunity for query " + stat.getQueryId())
                        .details(spill + String.format(Locale.ROOT,
                                " It also reads %.0f blocks per returned row; an index on the filter and sort columns "
                                        + "avoids both the scan and the sort. %s",
                                stat.readRatio(), effective.describeBasis()))
                        .sql(IndexSuggestion.forQuery(stat.getQueryNorm()))
                        .build());
            } else {
                long workMemMb = suggestedWorkMemMb(tempPerCall);
                out.add(candidate
                        .type(RecommendationType.WORK_MEM)
                        .evidence(tempPerCall)
                        .title("Sorts spill to disk for query " + stat.getQueryId())
                        .details(spill + " Raise work_mem for the role or session running it; test per session "
                                + "before changing it globally, as every sort node may use that much memory. "
                                + effective.describeBasis())
                        .sql("SET work_mem = '" + workMemMb + "MB';")
                        .build());
            }
        }
        return out;
    }

    /**
     * Smallest power-of-two megabyte value covering twice the per-call spill, clamped to [8MB, 1GB].
     *
     * @param tempBlocksPerCall temp blocks written per call
     * @return work_mem in MB
     */
    static long suggestedWorkMemMb(double tempBlocksPerCall) {
        double neededMb = 2 * tempBlocksPerCall * BLOCK_BYTES / (1024.0 * 1024.0);
        long mb = MIN_WORK_MEM_MB;
        while (mb < neededMb && mb < MAX_WORK_MEM_MB) {
            mb *= 2;
        }
        return mb;
    }
}
