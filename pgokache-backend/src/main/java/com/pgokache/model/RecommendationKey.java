package com.pgokache.model;

import lombok.Value;

/**
 * Upsert identity of a recommendation. Instance-level types carry a null query id.
 */
@Value
public class RecommendationKey {
    long instanceId;
    RecommendationType type;
    String queryId;

    public static RecommendationKey of(long instanceId, RecommendationType type, String queryId) {
        return new RecommendationKey(instanceId, type, type.isPerQuery() ? queryId : null);
    }
}
