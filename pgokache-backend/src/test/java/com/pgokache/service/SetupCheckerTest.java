package com.pgokache.service;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.error.ErrorKind;
import com.pgokache.error.InstanceBusyException;
import com.pgokache.error.InstanceNotFoundException;
import com.pgokache.error.TargetAccessException;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.model.SetupInfo;
import com.pgokache.model.SetupState;
import com.pgokache.model.SetupStatus;
import com.pgokache.store.SetupStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.sql.SQLException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SetupCheckerTest {

    private static final long INSTANCE_ID = 1L;

    private InstanceRegistry registry;
    private TargetConnectionFactory connectionFactory;
    private PgCatalogReader catalogReader;
    private TargetConnection target;
    private SetupStateStore stateStore;
    private SetupChecker checker;

    @BeforeEach
    void setUp() {
        registry = mock(InstanceRegistry.class);
        connectionFactory = mock(TargetConnectionFactory.class);
        catalogReader = mock(PgCatalogReader.class);
        target = mock(TargetConnection.class);
        stateStore = new SetupStateStore();
        checker = new SetupChecker(registry, connectionFactory, catalogReader,
                new InstanceLockManager(new PgOkacheProperties()), stateStore);

        when(registry.describe(INSTANCE_ID)).thenReturn(ConnectionDescriptor.builder()
                .instanceId(INSTANCE_ID)
                .host("db.internal")
                .port(5432)
                .dbname("app")
                .user("monitor")
                .password("secret")
                .sslMode("prefer")
                .build());
        when(connectionFactory.open(any(ConnectionDescriptor.class))).thenReturn(target);
    }

    private void stubServer(String preload, boolean created) throws SQLException {
        when(catalogReader.setting(target, "server_version")).thenReturn("16.2");
        when(catalogReader.setting(target, "server_version_num")).thenReturn("160002");
        when(catalogReader.setting(target, "shared_preload_libraries")).thenReturn(preload);
        when(catalogReader.extensionAvailable(target)).thenReturn(true);
        when(catalogReader.extensionCreated(target)).thenReturn(created);
        when(catalogReader.hasStatementsView(target)).thenReturn(created);
    }

    @Test
    void reportsPreloadMissingWhenLibraryIsNotPreloaded() throws Exception {
        stubServer("", false);

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.PRELOAD_MISSING);
        assertThat(info.isReady()).isFalse();
        assertThat(info.isPreloadOk()).isFalse();
        assertThat(info.isExtCreated()).isFalse();
        assertThat(info.getPgVersionNum()).isEqualTo(160002);
        assertThat(info.getPgMajorVersion()).isEqualTo(16);
        assertThat(info.getChecks())
                .containsEntry("server_version", "16.2")
                .containsEntry("shared_preload_libraries", "")
                .containsEntry("extension_available", true)
                .containsEntry("extension_created", false);
        assertThat(info.getError()).isNull();
        verify(target).close();
    }

    @Test
    void reportsReadyWhenPreloadedAndCreated() throws Exception {
        stubServer("auto_explain, \"pg_stat_statements\"", true);
        when(catalogReader.setting(target, "pg_stat_statements.track")).thenReturn("top");

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.READY);
        assertThat(info.isReady()).isTrue();
        assertThat(info.getChecks()).containsEntry("has_view", true);
        assertThat(info.getParams()).containsEntry("pg_stat_statements.track", "top");

        SetupState stored = stateStore.find(INSTANCE_ID).orElseThrow();
        assertThat(stored.isReady()).isTrue();
        assertThat(stored.getStatus()).isEqualTo(SetupStatus.READY);
        assertThat(stored.getPgMajorVersion()).isEqualTo(16);
    }

    @Test
    void reportsExtensionMissingWhenPreloadedButNotCreated() throws Exception {
        stubServer("pg_stat_statements", false);

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.EXTENSION_MISSING);
        assertThat(info.isPreloadOk()).isTrue();
        assertThat(info.isReady()).isFalse();
    }

    @Test
    void connectionFailureIsReportedAndStoredWithoutProbing() {
        when(connectionFactory.open(any(ConnectionDescriptor.class))).thenThrow(new TargetAccessException(
                ErrorKind.CONNECTION_ERROR, "The instance could not be reached.", new ConnectException("refused")));

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.CONNECTION_FAILED);
        assertThat(info.isReady()).isFalse();
        assertThat(info.getError().getCode()).isEqualTo("CONNECTION_ERROR");
        assertThat(info.getChecks()).containsKeys("server_version", "extension_created");
        assertThat(info.getChecks().values()).containsOnlyNulls();
        assertThat(stateStore.find(INSTANCE_ID)).get()
                .extracting(SetupState::getStatus)
                .isEqualTo(SetupStatus.CONNECTION_FAILED);
        verifyNoInteractions(catalogReader);
    }

    @Test
    void authFailureIsAConnectionFailureWithAuthCode() {
        when(connectionFactory.open(any(ConnectionDescriptor.class))).thenThrow(new TargetAccessException(
                ErrorKind.AUTH_ERROR, "The instance rejected the saved credentials.", null));

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.CONNECTION_FAILED);
        assertThat(info.getError().getCode()).isEqualTo("AUTH_ERROR");
    }

    @Test
    void permissionErrorStopsProbingAndReportsPermissionDenied() throws Exception {
        when(catalogReader.setting(target, "server_version")).thenReturn("16.2");
        when(catalogReader.setting(target, "server_version_num")).thenReturn("160002");
        when(catalogReader.setting(target, "shared_preload_libraries"))
                .thenThrow(new SQLException("permission denied to examine \"shared_preload_libraries\"", "42501"));

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.PERMISSION_DENIED);
        assertThat(info.isReady()).isFalse();
        assertThat(info.getError().getCode()).isEqualTo("PERMISSION_ERROR");
        assertThat(info.getChecks())
                .containsEntry("server_version_num", 160002)
                .containsEntry("shared_preload_libraries", null);
        verify(catalogReader, never()).extensionCreated(target);
        verify(target).close();
    }

    @Test
    void informationalProbeFailureKeepsVerdict() throws Exception {
        stubServer("pg_stat_statements", true);
        when(catalogReader.hasStatementsView(target)).thenThrow(new SQLException("boom", "XX000"));

        SetupInfo info = checker.check(INSTANCE_ID);

        assertThat(info.getStatus()).isEqualTo(SetupStatus.READY);
        assertThat(info.isReady()).isTrue();
        assertThat(info.getChecks()).containsEntry("has_view", null);
    }

    @Test
    void repeatedChecksReplaceStoredState() throws Exception {
        stubServer("pg_stat_statements", false);
        checker.check(INSTANCE_ID);
        assertThat(stateStore.find(INSTANCE_ID)).get().extracting(SetupState::getStatus)
                .isEqualTo(SetupStatus.EXTENSION_MISSING);

        when(catalogReader.extensionCreated(target)).thenReturn(true);
        SetupInfo second = checker.check(INSTANCE_ID);
        SetupInfo third = checker.check(INSTANCE_ID);

        assertThat(second.getStatus()).isEqualTo(third.getStatus()).isEqualTo(SetupStatus.READY);
        assertThat(stateStore.list()).hasSize(1);
        assertThat(stateStore.find(INSTANCE_ID)).get().extracting(SetupState::isReady).isEqualTo(true);
    }

    @Test
    void unknownInstanceIsRejected() {
        when(registry.describe(42L)).thenThrow(new InstanceNotFoundException(42L));

        assertThatThrownBy(() -> checker.check(42L)).isInstanceOf(InstanceNotFoundException.class);
        assertThat(stateStore.find(42L)).isEmpty();
    }

    @Test
    void concurrentCheckOnSameInstanceIsRejected() throws Exception {
        stubServer("pg_stat_statements", true);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            when(catalogReader.setting(target, "server_version")).thenAnswer(invocation -> {
                Future<SetupInfo> second = executor.submit(() -> checker.check(INSTANCE_ID));
                try {
                    second.get(5, TimeUnit.SECONDS);
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InstanceBusyException.class);
                    return "16.2";
                }
                throw new AssertionError("second check should have been rejected");
            });

            SetupInfo info = checker.check(INSTANCE_ID);

            assertThat(info.getStatus()).isEqualTo(SetupStatus.READY);
        } finally {
            executor.shutdownNow();
        }
    }
}
