package com.pgokache.advisor;

import java.util.List;

/**
 * One independently evaluable heuristic. Per-query rules emit at most one candidate per query.
 */
public interface RecommendationRule {

    String name();

    List<RecommendationCandidate> evaluate(RuleContext context);
}
