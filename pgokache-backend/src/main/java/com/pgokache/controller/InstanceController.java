package com.pgokache.controller;

import com.pgokache.advisor.RecommendationEngine;
import com.pgokache.api.CollectResponse;
import com.pgokache.api.InstancePatchRequest;
import com.pgokache.api.InstanceRequest;
import com.pgokache.collector.SnapshotCollector;
import com.pgokache.model.Instance;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupInfo;
import com.pgokache.service.InstanceRegistry;
import com.pgokache.service.SetupChecker;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Instance registry and the per-instance check, collect and recommend actions.
 */
@RestController
@RequestMapping("/instances")
public class InstanceController {

    private final InstanceRegistry registry;
    private final SetupChecker setupChecker;
    private final SnapshotCollector snapshotCollector;
    private final RecommendationEngine recommendationEngine;

    public InstanceController(
            InstanceRegistry registry,
            SetupChecker setupChecker,
            SnapshotCollector snapshotCollector,
            RecommendationEngine recommendationEngine
    ) {
        this.registry = registry;
        this.setupChecker = setupChecker;
        this.snapshotCollector = snapshotCollector;
        this.recommendationEngine = recommendationEngine;
    }

    @GetMapping("/")
    public List<Instance> list() {
        return registry.list();
    }

    /**
     * Save a new instance. The password is encrypted before it is stored and never returned.
     *
     * POST /instances/
     *
     * @param request connection settings
     * @return created instance
     */
    @PostMapping("/")
    public ResponseEntity<Instance> create(@Valid @RequestBody InstanceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.create(request));
    }

    @GetMapping("/{id}/")
    public Instance get(@PathVariable("id") long id) {
        return registry.get(id);
    }

    @PatchMapping("/{id}/")
    public Instance patch(@PathVariable("id") long id, @Valid @RequestBody InstancePatchRequest request) {
        return registry.patch(id, request);
    }

    /**
     * Probe pg_stat_statements readiness. Connection and permission failures are part of the
     * returned body, not an error status.
     *
     * POST /instances/{id}/check_setup/
     *
     * @param id instance id
     * @return setup info
     */
    @PostMapping("/{id}/check_setup/")
    public SetupInfo checkSetup(@PathVariable("id") long id) {
        return setupChecker.check(id);
    }

    @PostMapping("/{id}/collect/")
    public CollectResponse collect(@PathVariable("id") long id) {
        return snapshotCollector.collect(id);
    }

    @PostMapping("/{id}/recommend/")
    public List<Recommendation> recommend(@PathVariable("id") long id) {
        registry.get(id);
        return recommendationEngine.recommend(id);
    }
}
