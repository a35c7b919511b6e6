package com.pgokache.collector;

import com.pgokache.advisor.RecommendationEngine;
import com.pgokache.api.CollectResponse;
import com.pgokache.config.PgOkacheProperties;
import com.pgokache.error.ErrorKind;
import com.pgokache.error.InstanceNotFoundException;
import com.pgokache.error.NotReadyException;
import com.pgokache.error.TargetAccessException;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupState;
import com.pgokache.model.SetupStatus;
import com.pgokache.model.Snapshot;
import com.pgokache.service.InstanceLockManager;
import com.pgokache.service.InstanceRegistry;
import com.pgokache.service.PgCatalogReader;
import com.pgokache.service.TargetConnection;
import com.pgokache.service.TargetConnectionFactory;
import com.pgokache.store.SetupStateStore;
import com.pgokache.store.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SnapshotCollectorTest {

    private static final long INSTANCE_ID = 1L;

    private InstanceRegistry registry;
    private TargetConnectionFactory connectionFactory;
    private PgCatalogReader catalogReader;
    private PgStatStatementsReader statementsReader;
    private TargetConnection target;
    private SetupStateStore setupStateStore;
    private SnapshotStore snapshotStore;
    private RecommendationEngine engine;
    private PgOkacheProperties properties;
    private SnapshotCollector collector;

    @BeforeEach
    void setUp() throws Exception {
        registry = mock(InstanceRegistry.class);
        connectionFactory = mock(TargetConnectionFactory.class);
        catalogReader = mock(PgCatalogReader.class);
        statementsReader = mock(PgStatStatementsReader.class);
        target = mock(TargetConnection.class);
        engine = mock(RecommendationEngine.class);
        setupStateStore = new SetupStateStore();
        snapshotStore = new SnapshotStore();
        properties = new PgOkacheProperties();
        collector = new SnapshotCollector(registry, connectionFactory, catalogReader, statementsReader,
                new QueryTextNormalizer(2000, false), new InstanceLockManager(properties),
                setupStateStore, snapshotStore, engine, properties);

        when(registry.get(INSTANCE_ID)).thenReturn(Instance.builder().id(INSTANCE_ID).name("primary").build());
        when(registry.describe(INSTANCE_ID)).thenReturn(ConnectionDescriptor.builder()
                .instanceId(INSTANCE_ID).host("db.internal").port(5432).dbname("app").user("monitor").password("pw")
                .build());
        when(connectionFactory.open(any(ConnectionDescriptor.class))).thenReturn(target);
        when(catalogReader.extensionCreated(target)).thenReturn(true);
    }

    private void markReady(boolean ready) {
        setupStateStore.save(SetupState.builder()
                .instanceId(INSTANCE_ID)
                .pgVersionNum(160002)
                .pgMajorVersion(16)
                .preloadOk(true)
                .extCreated(ready)
                .ready(ready)
                .status(ready ? SetupStatus.READY : SetupStatus.EXTENSION_MISSING)
                .lastCheckedAt(OffsetDateTime.now())
                .build());
    }

    private static QueryStat stat(String id, String query, long calls, double totalTimeMs) {
        return QueryStat.builder()
                .queryId(id)
                .queryNorm(query)
                .calls(calls)
                .totalTimeMs(totalTimeMs)
                .meanTimeMs(calls > 0 ? totalTimeMs / calls : 0)
                .build();
    }

    @Test
    void storesFilteredAndRedactedSnapshotThenRecommends() throws Exception {
        markReady(true);
        when(statementsReader.read(target, 16, 100)).thenReturn(List.of(
                stat("101", "SELECT * FROM orders WHERE id = 42", 500, 9000),
                stat("102", "UPDATE accounts SET balance = $1 WHERE id = $2", 40, 700),
                stat("103", "SELECT pg_sleep(1)", 2, 2000),
                stat("104", "SELECT 1", 1000, 10)));
        when(engine.recommend(INSTANCE_ID)).thenReturn(List.of(new Recommendation()));

        CollectResponse response = collector.collect(INSTANCE_ID);

        assertThat(response.getRows()).isEqualTo(2);
        assertThat(response.getRecommendations()).isEqualTo(1);
        Snapshot stored = snapshotStore.latest(INSTANCE_ID).orElseThrow();
        assertThat(stored.getId()).isEqualTo(response.getSnapshotId());
        assertThat(stored.getQueryStats()).extracting(QueryStat::getQueryId).containsExactly("101", "102");
        assertThat(stored.getQueryStats().get(0).getQueryNorm()).isEqualTo("SELECT * FROM orders WHERE id = ?");
        verify(target).close();
        verify(engine).recommend(INSTANCE_ID);
    }

    @Test
    void skipsEngineWhenDisabled() throws Exception {
        properties.getAdvisor().setRunAfterCollect(false);
        markReady(true);
        when(statementsReader.read(eq(target), eq(16), anyInt())).thenReturn(List.of());

        CollectResponse response = collector.collect(INSTANCE_ID);

        assertThat(response.getRows()).isZero();
        assertThat(response.getRecommendations()).isZero();
        assertThat(snapshotStore.count(INSTANCE_ID)).isEqualTo(1);
        verifyNoInteractions(engine);
    }

    @Test
    void refusesWithoutReadySetupState() {
        assertThatThrownBy(() -> collector.collect(INSTANCE_ID))
                .isInstanceOf(NotReadyException.class)
                .hasMessageContaining("check_setup");

        markReady(false);
        assertThatThrownBy(() -> collector.collect(INSTANCE_ID)).isInstanceOf(NotReadyException.class);

        verifyNoInteractions(connectionFactory);
        assertThat(snapshotStore.count(INSTANCE_ID)).isZero();
    }

    @Test
    void refusesWhenExtensionWasDroppedSinceCheck() throws Exception {
        markReady(true);
        when(catalogReader.extensionCreated(target)).thenReturn(false);

        assertThatThrownBy(() -> collector.collect(INSTANCE_ID)).isInstanceOf(NotReadyException.class);

        verify(statementsReader, never()).read(any(), any(), anyInt());
        verify(target).close();
        assertThat(snapshotStore.count(INSTANCE_ID)).isZero();
    }

    @Test
    void failureWhileReadingStoresNothing() throws Exception {
        markReady(true);
        when(statementsReader.read(target, 16, 100))
                .thenThrow(new SQLException("canceling statement due to statement timeout", "57014"));

        assertThatThrownBy(() -> collector.collect(INSTANCE_ID))
                .isInstanceOfSatisfying(TargetAccessException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_ERROR));

        assertThat(snapshotStore.count(INSTANCE_ID)).isZero();
        verifyNoInteractions(engine);
    }

    @Test
    void permissionDeniedIsClassified() throws Exception {
        markReady(true);
        when(statementsReader.read(target, 16, 100))
                .thenThrow(new SQLException("permission denied for view pg_stat_statements", "42501"));

        assertThatThrownBy(() -> collector.collect(INSTANCE_ID))
                .isInstanceOfSatisfying(TargetAccessException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.PERMISSION_ERROR));
        assertThat(snapshotStore.count(INSTANCE_ID)).isZero();
    }

    @Test
    void libraryNotLoadedIsNotReady() throws Exception {
        markReady(true);
        when(statementsReader.read(target, 16, 100))
                .thenThrow(new SQLException("pg_stat_statements must be loaded via shared_preload_libraries", "55000"));

        assertThatThrownBy(() -> collector.collect(INSTANCE_ID))
                .isInstanceOfSatisfying(TargetAccessException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_READY));
    }

    @Test
    void unknownInstanceIsNotFound() {
        when(registry.get(9L)).thenThrow(new InstanceNotFoundException(9L));

        assertThatThrownBy(() -> collector.collect(9L)).isInstanceOf(InstanceNotFoundException.class);
    }
}
