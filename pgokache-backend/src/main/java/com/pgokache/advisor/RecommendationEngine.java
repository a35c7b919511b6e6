package com.pgokache.advisor;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.error.InvalidTransitionException;
import com.pgokache.error.RecommendationNotFoundException;
import com.pgokache.model.Confidence;
import com.pgokache.model.Recommendation;
import com.pgokache.model.RecommendationKey;
import com.pgokache.model.RecommendationStatus;
import com.pgokache.model.Snapshot;
import com.pgokache.store.RecommendationStore;
import com.pgokache.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives recommendations from the latest snapshot of an instance and reconciles them with the
 * stored ones.
 *
 * <p>Pure computation over stored snapshots; the only shared state is the per-instance upsert,
 * which runs under {@link RecommendationStore#withInstanceLock}. The engine never deletes and
 * never changes a recommendation out of {@code pending}.
 */
@Slf4j
@Service
public class RecommendationEngine {
    private final SnapshotStore snapshotStore;
    private final RecommendationStore recommendationStore;
    private final CounterDeltaCalculator deltaCalculator;
    private final List<RecommendationRule> rules;
    private final PgOkacheProperties.Advisor thresholds;

    public RecommendationEngine(
            SnapshotStore snapshotStore,
            RecommendationStore recommendationStore,
            CounterDeltaCalculator deltaCalculator,
            List<RecommendationRule> rules,
            PgOkacheProperties properties
    ) {
        this.snapshotStore = snapshotStore;
        this.recommendationStore = recommendationStore;
        this.deltaCalculator = deltaCalculator;
        this.rules = rules;
        this.thresholds = properties.getAdvisor();
    }

    /**
     * Evaluate all rules for an instance and upsert the results.
     *
     * @param instanceId instance id
     * @return recommendations created or refreshed by this run; empty when there is no usable snapshot
     */
    public List<Recommendation> recommend(long instanceId) {
        List<Snapshot> recent = snapshotStore.recent(instanceId, 2);
        if (recent.isEmpty() || recent.get(0).isEmpty()) {
            log.debug("No snapshot data to analyse: instance_id={}", instanceId);
            return List.of();
        }
        Snapshot latest = recent.get(0);
        Snapshot previous = recent.size() > 1 ? recent.get(1) : null;

        List<EffectiveStat> stats = deltaCalculator.effectiveStats(latest, previous);
        RuleContext context = new RuleContext(instanceId, stats, thresholds);

        List<RecommendationCandidate> candidates = new ArrayList<>();
        for (RecommendationRule rule : rules) {
            List<RecommendationCandidate> produced = rule.evaluate(context);
            log.debug("Rule evaluated: instance_id={}, rule={}, candidates={}", instanceId, rule.name(), produced.size());
            candidates.addAll(produced);
        }

        Map<RecommendationKey, RecommendationCandidate> merged = merge(instanceId, candidates);
        List<Recommendation> touched = recommendationStore.withInstanceLock(instanceId,
                () -> upsertAll(instanceId, merged));

        log.info("Recommendation run finished: instance_id={}, snapshot_id={}, basis={}, candidates={}, upserted={}",
                instanceId, latest.getId(), previous != null ? "delta" : "absolute", merged.size(), touched.size());
        return touched;
    }

    /**
     * Collapse candidates sharing a key: the higher score wins, confidence is the higher of the two
     * and distinct details are concatenated.
     */
    static Map<RecommendationKey, RecommendationCandidate> merge(long instanceId, List<RecommendationCandidate> candidates) {
        Map<RecommendationKey, RecommendationCandidate> merged = new LinkedHashMap<>();
        for (RecommendationCandidate candidate : candidates) {
            RecommendationKey key = RecommendationKey.of(instanceId, candidate.getType(), candidate.getQueryId());
            merged.merge(key, candidate, RecommendationEngine::combine);
        }
        return merged;
    }

    private static RecommendationCandidate combine(RecommendationCandidate a, RecommendationCandidate b) {
        RecommendationCandidate winner = b.getScore() > a.getScore() ? b : a;
        RecommendationCandidate other = winner == a ? b : a;
        Confidence confidence = winner.getConfidence().compareTo(other.getConfidence()) >= 0
                ? winner.getConfidence()
                : other.getConfidence();
        String details = winner.getDetails().equals(other.getDetails())
                ? winner.getDetails()
                : winner.getDetails() + " " + other.getDetails();
        String sql = winner.getSql() != null && !winner.getSql().isBlank() ? winner.getSql() : other.getSql();
        return winner.toBuilder()
                .confidence(confidence)
                .details(details)
                .sql(sql)
                .evidence(Math.max(a.getEvidence(), b.getEvidence()))
                .build();
    }

    private List<Recommendation> upsertAll(long instanceId, Map<RecommendationKey, RecommendationCandidate> candidates) {
        OffsetDateTime now = OffsetDateTime.now();
        List<Recommendation> touched = new ArrayList<>();
        for (Map.Entry<RecommendationKey, RecommendationCandidate> entry : candidates.entrySet()) {
            upsert(instanceId, entry.getKey(), entry.getValue(), now).ifPresent(touched::add);
        }
        return touched;
    }

    private Optional<Recommendation> upsert(long instanceId, RecommendationKey key, RecommendationCandidate candidate,
                                            OffsetDateTime now) {
        List<Recommendation> existing = recommendationStore.findByKey(key);

        Optional<Recommendation> pending = existing.stream()
                .filter(r -> r.getStatus() == RecommendationStatus.PENDING)
                .findFirst();
        if (pending.isPresent()) {
            Recommendation refreshed = pending.get().toBuilder()
                    .title(candidate.getTitle())
                    .details(candidate.getDetails())
                    .sql(nullToEmpty(candidate.getSql()))
                    .confidence(candidate.getConfidence())
                    .score(candidate.getScore())
                    .evidence(candidate.getEvidence())
                    .updatedAt(now)
                    .build();
            return Optional.of(recommendationStore.update(refreshed));
        }

        Optional<Recommendation> lastDecided = existing.stream()
                .filter(r -> r.getStatus().isTerminal())
                .max(Comparator.comparing(Recommendation::getUpdatedAt, Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder()))
                        .thenComparingLong(Recommendation::getId));
        if (lastDecided.isPresent() && !isSubstantiallyStronger(candidate, lastDecided.get())) {
            log.debug("Keeping {} recommendation untouched: id={}, key={}",
                    lastDecided.get().getStatus().getCode(), lastDecided.get().getId(), key);
            return Optional.empty();
        }
        if (lastDecided.isPresent()) {
            log.info("Reopening advice after stronger evidence: instance_id={}, type={}, queryid={}, previous_id={}",
                    instanceId, key.getType().getCode(), key.getQueryId(), lastDecided.get().getId());
        }

        Recommendation created = Recommendation.builder()
                .instanceId(instanceId)
                .type(candidate.getType())
                .queryId(key.getQueryId())
                .title(candidate.getTitle())
                .details(candidate.getDetails())
                .sql(nullToEmpty(candidate.getSql()))
                .confidence(candidate.getConfidence())
                .score(candidate.getScore())
                .evidence(candidate.getEvidence())
                .status(RecommendationStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return Optional.of(recommendationStore.insert(created));
    }

    /**
     * Operator decision on a pending recommendation.
     *
     * @param recommendationId recommendation id
     * @param next {@code applied} or {@code dismissed}
     * @return updated recommendation
     * @throws RecommendationNotFoundException unknown id
     * @throws InvalidTransitionException the recommendation is already applied or dismissed
     */
    public Recommendation changeStatus(long recommendationId, RecommendationStatus next) {
        Recommendation current = recommendationStore.find(recommendationId)
                .orElseThrow(() -> new RecommendationNotFoundException(recommendationId));
        return recommendationStore.withInstanceLock(current.getInstanceId(), () -> {
            Recommendation fresh = recommendationStore.find(recommendationId)
                    .orElseThrow(() -> new RecommendationNotFoundException(recommendationId));
            if (!fresh.getStatus().canTransitionTo(next)) {
                throw new InvalidTransitionException("Cannot change recommendation " + recommendationId
                        + " from " + fresh.getStatus().getCode() + " to " + (next != null ? next.getCode() : "null") + ".");
            }
            Recommendation updated = recommendationStore.update(fresh.toBuilder()
                    .status(next)
                    .updatedAt(OffsetDateTime.now())
                    .build());
            log.info("Recommendation status changed: id={}, instance_id={}, status={}",
                    recommendationId, updated.getInstanceId(), next.getCode());
            return updated;
        });
    }

    boolean isSubstantiallyStronger(RecommendationCandidate candidate, Recommendation decided) {
        double baseline = decided.getEvidence();
        if (baseline <= 0) {
            return candidate.getEvidence() > 0;
        }
        return candidate.getEvidence() >= baseline * thresholds.getResurrectFactor();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
