package com.pgokache.advisor;

import com.pgokache.model.Confidence;
import com.pgokache.model.RecommendationType;
import lombok.Builder;
import lombok.Value;

/**
 * A rule's proposal before it is reconciled with stored recommendations.
 */
@Value
@Builder(toBuilder = true)
public class RecommendationCandidate {
    RecommendationType type;
    String queryId;
    String title;
    String details;
    String sql;
    Confidence confidence;
    double score;
    double evidence;
}
