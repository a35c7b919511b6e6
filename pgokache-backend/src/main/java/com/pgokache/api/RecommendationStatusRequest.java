package com.pgokache.api;

import com.pgokache.model.RecommendationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecommendationStatusRequest {
    @NotNull(message = "Status is required")
    private RecommendationStatus status;
}
