package com.pgokache.collector;

import com.pgokache.advisor.RecommendationEngine;
import com.pgokache.api.CollectResponse;
import com.pgokache.config.PgOkacheProperties;
import com.pgokache.error.NotReadyException;
import com.pgokache.error.PgOkacheException;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.model.QueryStat;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;
import com.pgokache.service.InstanceLockManager;
import com.pgokache.service.InstanceRegistry;
import com.pgokache.service.PgCatalogReader;
import com.pgokache.service.TargetConnection;
import com.pgokache.service.TargetConnectionFactory;
import com.pgokache.store.SetupStateStore;
import com.pgokache.store.SnapshotStore;
import com.pgokache.util.SqlErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures pg_stat_statements of a ready instance as one immutable snapshot.
 *
 * <p>Rows are fully read before anything is stored, so a failed collection leaves no partial
 * snapshot behind.
 */
@Slf4j
@Service
public class SnapshotCollector {
    private final InstanceRegistry registry;
    private final TargetConnectionFactory connectionFactory;
    private final PgCatalogReader catalogReader;
    private final PgStatStatementsReader statementsReader;
    private final QueryTextNormalizer normalizer;
    private final InstanceLockManager lockManager;
    private final SetupStateStore setupStateStore;
    private final SnapshotStore snapshotStore;
    private final RecommendationEngine engine;
    private final PgOkacheProperties properties;

    public SnapshotCollector(
            InstanceRegistry registry,
            TargetConnectionFactory connectionFactory,
            PgCatalogReader catalogReader,
            PgStatStatementsReader statementsReader,
            QueryTextNormalizer normalizer,
            InstanceLockManager lockManager,
            SetupStateStore setupStateStore,
            SnapshotStore snapshotStore,
            RecommendationEngine engine,
            PgOkacheProperties properties
    ) {
        this.registry = registry;
        this.connectionFactory = connectionFactory;
        this.catalogReader = catalogReader;
        this.statementsReader = statementsReader;
        this.normalizer = normalizer;
        this.lockManager = lockManager;
        this.setupStateStore = setupStateStore;
        this.snapshotStore = snapshotStore;
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * Collect a snapshot and, when configured, refresh recommendations from it.
     *
     * @param instanceId instance id
     * @return summary of the stored snapshot
     * @throws com.pgokache.error.InstanceNotFoundException unknown instance
     * @throws NotReadyException setup was never checked, is incomplete, or the extension vanished
     * @throws com.pgokache.error.TargetAccessException connection, auth or permission failures
     * @throws com.pgokache.error.InstanceBusyException a check or collection is already in flight
     */
    public CollectResponse collect(long instanceId) {
        Snapshot snapshot = lockManager.withInstanceLock(instanceId, "collection", () -> capture(instanceId));

        int recommendations = 0;
        if (properties.getAdvisor().isRunAfterCollect()) {
            recommendations = engine.recommend(instanceId).size();
        }
        return CollectResponse.builder()
                .snapshotId(snapshot.getId())
                .instanceId(instanceId)
                .capturedAt(snapshot.getCapturedAt())
                .rows(snapshot.getQueryStats().size())
                .recommendations(recommendations)
                .build();
    }

    private Snapshot capture(long instanceId) {
        registry.get(instanceId);
        SetupState state = setupStateStore.find(instanceId)
                .filter(SetupState::isReady)
                .orElseThrow(() -> new NotReadyException(
                        "pg_stat_statements is not ready on instance " + instanceId + "; run check_setup first."));

        ConnectionDescriptor descriptor = registry.describe(instanceId);
        List<QueryStat> raw;
        try (TargetConnection target = connectionFactory.open(descriptor)) {
            if (!catalogReader.extensionCreated(target)) {
                throw new NotReadyException("Extension pg_stat_statements is not created in database "
                        + descriptor.getDbname() + "; run check_setup after creating it.");
            }
            Integer major = state.getPgMajorVersion() != null
                    ? state.getPgMajorVersion()
                    : majorVersionOf(catalogReader.setting(target, "server_version_num"));
            raw = statementsReader.read(target, major, properties.getCollector().getTopN());
        } catch (PgOkacheException e) {
            throw e;
        } catch (SQLException | RuntimeException e) {
            log.warn("Collection failed: instance_id={}, error={}", instanceId, e.getClass().getSimpleName());
            throw SqlErrorClassifier.classify(e, "reading pg_stat_statements");
        }

        List<QueryStat> rows = prepare(raw);
        Snapshot snapshot = snapshotStore.save(instanceId, OffsetDateTime.now(), rows);
        log.info("Snapshot stored: instance_id={}, snapshot_id={}, rows={}, read={}",
                instanceId, snapshot.getId(), rows.size(), raw.size());
        return snapshot;
    }

    /**
     * Drop rows under the noise thresholds and redact their text, keeping server order.
     *
     * @param raw rows as read
     * @return rows to store
     */
    List<QueryStat> prepare(List<QueryStat> raw) {
        PgOkacheProperties.Collector c = properties.getCollector();
        List<QueryStat> rows = new ArrayList<>(raw.size());
        for (QueryStat stat : raw) {
            if (stat.getCalls() < c.getMinCalls() || stat.getTotalTimeMs() < c.getMinTotalTimeMs()) {
                continue;
            }
            rows.add(stat.toBuilder().queryNorm(normalizer.normalize(stat.getQueryNorm())).build());
        }
        return rows;
    }

    private static Integer majorVersionOf(String versionNum) {
        if (versionNum == null || versionNum.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(versionNum.trim()) / 10000;
        } catch (NumberFormatException e) {
            log.warn("Unparseable server_version_num: {}", versionNum);
            return null;
        }
    }
}
