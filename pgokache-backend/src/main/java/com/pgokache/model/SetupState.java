package com.pgokache.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Latest readiness verdict stored for an instance. Replaced whole on every check.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SetupState {
    long instanceId;
    Integer pgVersionNum;
    Integer pgMajorVersion;
    boolean preloadOk;
    boolean extCreated;
    boolean ready;
    SetupStatus status;
    OffsetDateTime lastCheckedAt;
}
