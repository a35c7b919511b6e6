package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one setup check, rendered by clients as a step-by-step guide.
 *
 * <p>{@code checks} holds one entry per probe in execution order. A {@code null} value means the
 * probe was skipped because an earlier step failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SetupInfo {
    private long instanceId;
    private SetupStatus status;
    private boolean ready;
    private Integer pgVersionNum;
    private Integer pgMajorVersion;
    private String serverVersion;
    private boolean preloadOk;
    private boolean extCreated;
    @Builder.Default
    private Map<String, Object> checks = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> params = new LinkedHashMap<>();
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private SetupError error;
    private OffsetDateTime checkedAt;

    /**
     * Why a check could not complete.
     */
    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class SetupError {
        private String code;
        private String detail;
    }

    public SetupState toState() {
        return SetupState.builder()
                .instanceId(instanceId)
                .pgVersionNum(pgVersionNum)
                .pgMajorVersion(pgMajorVersion)
                .preloadOk(preloadOk)
                .extCreated(extCreated)
                .ready(ready)
                .status(status)
                .lastCheckedAt(checkedAt)
                .build();
    }
}
