package com.pgokache.service;

import com.pgokache.config.PgOkacheProperties;
import com.pgokache.error.InstanceBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes setup checks and collections per instance so that no two sessions probe the
 * same target at once. Different instances never contend.
 */
@Slf4j
@Component
public class InstanceLockManager {
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long waitMs;

    public InstanceLockManager(PgOkacheProperties properties) {
        this.waitMs = Math.max(0, properties.getLockWaitMs());
    }

    /**
     * Run an action while holding the instance's lock.
     *
     * @param instanceId instance id
     * @param operation name used in logs
     * @param action action to run
     * @param <T> result type
     * @return action result
     * @throws InstanceBusyException when the lock is not acquired within the configured wait
     */
    public <T> T withInstanceLock(long instanceId, String operation, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(instanceId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = waitMs > 0 ? lock.tryLock(waitMs, TimeUnit.MILLISECONDS) : lock.tryLock();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InstanceBusyException(instanceId);
        }
        if (!acquired) {
            log.info("Rejected {}: another operation is in flight for instance_id={}", operation, instanceId);
            throw new InstanceBusyException(instanceId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(long instanceId) {
        ReentrantLock lock = locks.get(instanceId);
        return lock != null && lock.isLocked();
    }
}
