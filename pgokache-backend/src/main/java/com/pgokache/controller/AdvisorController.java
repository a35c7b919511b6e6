package com.pgokache.controller;

import com.pgokache.advisor.RecommendationEngine;
import com.pgokache.api.RecommendationStatusRequest;
import com.pgokache.config.PgOkacheProperties;
import com.pgokache.model.Recommendation;
import com.pgokache.model.RecommendationStatus;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;
import com.pgokache.service.InstanceRegistry;
import com.pgokache.store.RecommendationStore;
import com.pgokache.store.SetupStateStore;
import com.pgokache.store.SnapshotStore;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read side: setup states, latest snapshots and recommendations, plus operator decisions.
 */
@RestController
public class AdvisorController {

    private final InstanceRegistry registry;
    private final SetupStateStore setupStateStore;
    private final SnapshotStore snapshotStore;
    private final RecommendationStore recommendationStore;
    private final RecommendationEngine recommendationEngine;
    private final PgOkacheProperties properties;

    public AdvisorController(
            InstanceRegistry registry,
            SetupStateStore setupStateStore,
            SnapshotStore snapshotStore,
            RecommendationStore recommendationStore,
            RecommendationEngine recommendationEngine,
            PgOkacheProperties properties
    ) {
        this.registry = registry;
        this.setupStateStore = setupStateStore;
        this.snapshotStore = snapshotStore;
        this.recommendationStore = recommendationStore;
        this.recommendationEngine = recommendationEngine;
        this.properties = properties;
    }

    @GetMapping("/setup-states/")
    public List<SetupState> setupStates() {
        return setupStateStore.list();
    }

    /**
     * Latest snapshot per instance, rows trimmed to {@code top} for display.
     *
     * GET /snapshots/?instance=1&top=8
     *
     * @param instance optional instance filter
     * @param top rows per snapshot, defaults to pgokache.collector.display-top
     * @return snapshots, newest first
     */
    @GetMapping("/snapshots/")
    public List<Snapshot> snapshots(
            @RequestParam(value = "instance", required = false) Long instance,
            @RequestParam(value = "top", required = false) Integer top
    ) {
        int limit = top != null ? top : properties.getCollector().getDisplayTop();
        if (limit < 0) {
            throw new IllegalArgumentException("top must not be negative");
        }
        List<Snapshot> latest;
        if (instance != null) {
            registry.get(instance);
            latest = snapshotStore.latest(instance).map(s -> List.of(s)).orElse(List.of());
        } else {
            latest = snapshotStore.latestPerInstance();
        }
        return latest.stream().map(s -> s.limitedTo(limit)).toList();
    }

    @GetMapping("/recommendations/")
    public List<Recommendation> recommendations(
            @RequestParam(value = "instance", required = false) Long instance,
            @RequestParam(value = "status", required = false) String status
    ) {
        RecommendationStatus filter = status != null && !status.isBlank() ? RecommendationStatus.fromCode(status) : null;
        return recommendationStore.list(instance, filter);
    }

    /**
     * Operator decision: mark a pending recommendation applied or dismissed.
     *
     * PATCH /recommendations/{id}/
     *
     * @param id recommendation id
     * @param request new status
     * @return updated recommendation
     */
    @PatchMapping("/recommendations/{id}/")
    public Recommendation changeStatus(@PathVariable("id") long id, @Valid @RequestBody RecommendationStatusRequest request) {
        return recommendationEngine.changeStatus(id, request.getStatus());
    }
}
