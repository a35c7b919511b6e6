package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * An actionable, scored suggestion for one instance.
 *
 * <p>{@code evidence} is the per-call magnitude the rule fired on (disk blocks read or temp
 * blocks written per call, or the read share for instance-level advice). It does not depend on
 * how far apart snapshots were taken, so it is what gets compared when deciding whether a
 * dismissed recommendation deserves to come back. Scores are relative to one run and are not.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Recommendation {
    private long id;
    private long instanceId;
    private RecommendationType type;
    @JsonProperty("queryid")
    private String queryId;
    private String title;
    private String details;
    private String sql;
    private Confidence confidence;
    private double score;
    private double evidence;
    private RecommendationStatus status;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public RecommendationKey key() {
        return RecommendationKey.of(instanceId, type, queryId);
    }
}
