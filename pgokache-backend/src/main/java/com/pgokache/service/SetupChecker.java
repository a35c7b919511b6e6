package com.pgokache.service;

import com.pgokache.error.ErrorKind;
import com.pgokache.error.TargetAccessException;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.model.SetupInfo;
import com.pgokache.model.SetupStatus;
import com.pgokache.store.SetupStateStore;
import com.pgokache.util.SqlErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects whether pg_stat_statements is preloaded and created on an instance.
 *
 * <p>Never writes to the target. Each check replaces the stored {@link com.pgokache.model.SetupState}.
 */
@Slf4j
@Service
public class SetupChecker {
    static final String EXTENSION = "pg_stat_statements";

    static final String CHECK_SERVER_VERSION = "server_version";
    static final String CHECK_SERVER_VERSION_NUM = "server_version_num";
    static final String CHECK_PRELOAD = "shared_preload_libraries";
    static final String CHECK_AVAILABLE = "extension_available";
    static final String CHECK_CREATED = "extension_created";
    static final String CHECK_HAS_VIEW = "has_view";

    private static final List<String> CHECK_ORDER = List.of(
            CHECK_SERVER_VERSION,
            CHECK_SERVER_VERSION_NUM,
            CHECK_PRELOAD,
            CHECK_AVAILABLE,
            CHECK_CREATED,
            CHECK_HAS_VIEW
    );

    private static final List<String> PARAMS = List.of(
            "pg_stat_statements.track",
            "pg_stat_statements.max",
            "pg_stat_statements.save",
            "pg_stat_statements.track_utility"
    );

    private final InstanceRegistry registry;
    private final TargetConnectionFactory connectionFactory;
    private final PgCatalogReader catalogReader;
    private final InstanceLockManager lockManager;
    private final SetupStateStore setupStateStore;

    public SetupChecker(
            InstanceRegistry registry,
            TargetConnectionFactory connectionFactory,
            PgCatalogReader catalogReader,
            InstanceLockManager lockManager,
            SetupStateStore setupStateStore
    ) {
        this.registry = registry;
        this.connectionFactory = connectionFactory;
        this.catalogReader = catalogReader;
        this.lockManager = lockManager;
        this.setupStateStore = setupStateStore;
    }

    /**
     * Run all readiness probes against an instance and store the verdict.
     *
     * @param instanceId instance id
     * @return setup info; connection and permission failures are reported in it, not thrown
     * @throws com.pgokache.error.InstanceNotFoundException unknown instance
     * @throws com.pgokache.error.InstanceBusyException a check or collection is already in flight
     */
    public SetupInfo check(long instanceId) {
        return lockManager.withInstanceLock(instanceId, "setup check", () -> runCheck(instanceId));
    }

    private SetupInfo runCheck(long instanceId) {
        ConnectionDescriptor descriptor = registry.describe(instanceId);

        Map<String, Object> checks = new LinkedHashMap<>();
        CHECK_ORDER.forEach(name -> checks.put(name, null));
        SetupInfo info = SetupInfo.builder()
                .instanceId(instanceId)
                .checks(checks)
                .params(new LinkedHashMap<>())
                .checkedAt(OffsetDateTime.now())
                .build();

        try (TargetConnection target = connectionFactory.open(descriptor)) {
            probe(target, info);
        } catch (TargetAccessException e) {
            fail(info, e);
        }

        setupStateStore.save(info.toState());
        log.info("Setup check finished: instance_id={}, status={}, ready={}, pg_version_num={}",
                instanceId, info.getStatus(), info.isReady(), info.getPgVersionNum());
        return info;
    }

    private void probe(TargetConnection target, SetupInfo info) {
        Map<String, Object> checks = info.getChecks();

        String version = fatal(() -> catalogReader.setting(target, CHECK_SERVER_VERSION), "reading server_version");
        checks.put(CHECK_SERVER_VERSION, version);
        info.setServerVersion(version);

        String versionNum = fatal(() -> catalogReader.setting(target, CHECK_SERVER_VERSION_NUM), "reading server_version_num");
        Integer parsedVersion = parseVersionNum(versionNum);
        checks.put(CHECK_SERVER_VERSION_NUM, parsedVersion);
        info.setPgVersionNum(parsedVersion);
        info.setPgMajorVersion(parsedVersion != null ? parsedVersion / 10000 : null);

        String preload = fatal(() -> catalogReader.setting(target, CHECK_PRELOAD), "reading shared_preload_libraries");
        checks.put(CHECK_PRELOAD, preload != null ? preload : "");
        info.setPreloadOk(isPreloaded(preload));

        boolean available = fatal(() -> catalogReader.extensionAvailable(target), "reading pg_available_extensions");
        checks.put(CHECK_AVAILABLE, available);

        boolean created = fatal(() -> catalogReader.extensionCreated(target), "reading pg_extension");
        checks.put(CHECK_CREATED, created);
        info.setExtCreated(created);

        // Informational from here on: failures leave the probe null but keep the verdict.
        try {
            checks.put(CHECK_HAS_VIEW, catalogReader.hasStatementsView(target));
        } catch (SQLException e) {
            log.debug("has_view probe failed: instance_id={}, sql_state={}", info.getInstanceId(), e.getSQLState());
        }
        for (String param : PARAMS) {
            try {
                String value = catalogReader.setting(target, param);
                if (value != null) {
                    info.getParams().put(param, value);
                }
            } catch (SQLException e) {
                log.debug("Parameter probe failed: instance_id={}, param={}, sql_state={}",
                        info.getInstanceId(), param, e.getSQLState());
            }
        }

        info.setReady(info.isPreloadOk() && info.isExtCreated());
        info.setStatus(classify(info.isPreloadOk(), info.isExtCreated()));
    }

    private void fail(SetupInfo info, TargetAccessException e) {
        SetupStatus status = e.getKind() == ErrorKind.PERMISSION_ERROR
                ? SetupStatus.PERMISSION_DENIED
                : SetupStatus.CONNECTION_FAILED;
        info.setStatus(status);
        info.setReady(info.isPreloadOk() && info.isExtCreated());
        info.setError(new SetupInfo.SetupError(e.getKind().name(), e.getMessage()));
        log.warn("Setup check failed: instance_id={}, status={}, kind={}", info.getInstanceId(), status, e.getKind());
    }

    /**
     * Readiness verdict for successfully probed flags.
     *
     * @param preloadOk pg_stat_statements listed in shared_preload_libraries
     * @param extCreated extension created in the database
     * @return status
     */
    static SetupStatus classify(boolean preloadOk, boolean extCreated) {
        if (preloadOk && extCreated) {
            return SetupStatus.READY;
        }
        if (!preloadOk) {
            return SetupStatus.PRELOAD_MISSING;
        }
        return SetupStatus.EXTENSION_MISSING;
    }

    static boolean isPreloaded(String sharedPreloadLibraries) {
        if (sharedPreloadLibraries == null || sharedPreloadLibraries.isBlank()) {
            return false;
        }
        return Arrays.stream(sharedPreloadLibraries.split(","))
                .map(String::trim)
                .map(s -> s.replace("\"", ""))
                .anyMatch(EXTENSION::equals);
    }

    static Integer parseVersionNum(String versionNum) {
        if (versionNum == null || versionNum.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(versionNum.trim());
        } catch (NumberFormatException e) {
            log.warn("Unparseable server_version_num: {}", versionNum);
            return null;
        }
    }

    private static <T> T fatal(SqlCall<T> call, String action) {
        try {
            return call.call();
        } catch (SQLException e) {
            throw SqlErrorClassifier.classify(e, action);
        }
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }
}
