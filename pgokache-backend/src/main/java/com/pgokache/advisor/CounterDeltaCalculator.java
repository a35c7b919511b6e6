package com.pgokache.advisor;

import com.pgokache.model.QueryStat;
import com.pgokache.model.Snapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns cumulative pg_stat_statements counters into per-interval figures.
 *
 * <p>A counter that went down between captures means the statistics were reset (or the entry was
 * evicted and re-added); such a delta is discarded in favour of the later absolute values.
 *
 * <p>pg_stat_statements keeps one entry per user and top-level flag, so a snapshot may carry the
 * same queryid more than once. Those rows are summed before anything is compared.
 */
@Component
public class CounterDeltaCalculator {

    /**
     * Compute effective stats for every query in {@code latest}.
     *
     * @param latest newest snapshot
     * @param previous snapshot captured right before it, may be null
     * @return effective stats in the latest snapshot's order; queries idle in the interval are omitted
     */
    public List<EffectiveStat> effectiveStats(Snapshot latest, Snapshot previous) {
        if (latest == null || latest.isEmpty()) {
            return List.of();
        }
        Map<String, QueryStat> before = previous != null && !previous.isEmpty()
                ? byQueryId(previous.getQueryStats())
                : Map.of();

        List<EffectiveStat> out = new ArrayList<>();
        for (QueryStat current : byQueryId(latest.getQueryStats()).values()) {
            QueryStat earlier = before.get(current.getQueryId());
            if (earlier == null) {
                out.add(new EffectiveStat(current, EffectiveStat.Basis.ABSOLUTE));
            } else if (isReset(earlier, current)) {
                out.add(new EffectiveStat(current, EffectiveStat.Basis.RESET));
            } else {
                QueryStat delta = delta(earlier, current);
                if (delta.getCalls() > 0) {
                    out.add(new EffectiveStat(delta, EffectiveStat.Basis.DELTA));
                }
            }
        }
        return out;
    }

    /**
     * Index rows by queryid, summing the counters of repeated ids. First-seen order is kept.
     */
    static Map<String, QueryStat> byQueryId(Collection<QueryStat> stats) {
        Map<String, QueryStat> merged = new LinkedHashMap<>();
        for (QueryStat stat : stats) {
            merged.merge(stat.getQueryId(), stat, CounterDeltaCalculator::sum);
        }
        return merged;
    }

    static QueryStat sum(QueryStat a, QueryStat b) {
        long calls = a.getCalls() + b.getCalls();
        double totalTime = a.getTotalTimeMs() + b.getTotalTimeMs();
        return a.toBuilder()
                .calls(calls)
                .totalTimeMs(totalTime)
                .meanTimeMs(calls > 0 ? totalTime / calls : 0)
                .rows(a.getRows() + b.getRows())
                .sharedBlksHit(a.getSharedBlksHit() + b.getSharedBlksHit())
                .sharedBlksRead(a.getSharedBlksRead() + b.getSharedBlksRead())
                .tempBlksWritten(a.getTempBlksWritten() + b.getTempBlksWritten())
                .walBytes(a.getWalBytes() + b.getWalBytes())
                .build();
    }

    static boolean isReset(QueryStat earlier, QueryStat current) {
        return current.getCalls() < earlier.getCalls()
                || current.getTotalTimeMs() < earlier.getTotalTimeMs()
                || current.getRows() < earlier.getRows()
                || current.getSharedBlksHit() < earlier.getSharedBlksHit()
                || current.getSharedBlksRead() < earlier.getSharedBlksRead()
                || current.getTempBlksWritten() < earlier.getTempBlksWritten()
                || current.getWalBytes() < earlier.getWalBytes();
    }

    static QueryStat delta(QueryStat earlier, QueryStat current) {
        long calls = current.getCalls() - earlier.getCalls();
        double totalTime = current.getTotalTimeMs() - earlier.getTotalTimeMs();
        return current.toBuilder()
                .calls(calls)
                .totalTimeMs(totalTime)
                .meanTimeMs(calls > 0 ? totalTime / calls : 0)
                .rows(current.getRows() - earlier.getRows())
                .sharedBlksHit(current.getSharedBlksHit() - earlier.getSharedBlksHit())
                .sharedBlksRead(current.getSharedBlksRead() - earlier.getSharedBlksRead())
                .tempBlksWritten(current.getTempBlksWritten() - earlier.getTempBlksWritten())
                .walBytes(current.getWalBytes() - earlier.getWalBytes())
                .build();
    }
}
