package com.pgokache.store;

import com.pgokache.model.Recommendation;
import com.pgokache.model.RecommendationKey;
import com.pgokache.model.RecommendationStatus;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Recommendations per instance.
 *
 * <p>Read-modify-write sequences for one instance must run inside {@link #withInstanceLock}; the
 * engine and operator status changes both go through it. Callers always receive copies.
 */
@Component
public class RecommendationStore {
    private static final Comparator<Recommendation> RANKING = Comparator
            .comparingDouble(Recommendation::getScore).reversed()
            .thenComparing(Recommendation::getCreatedAt, Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder()))
            .thenComparingLong(Recommendation::getId);

    private final Map<Long, List<Recommendation>> byInstance = new ConcurrentHashMap<>();
    private final Map<Long, Long> instanceById = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public <T> T withInstanceLock(long instanceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(instanceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * All recommendations sharing an upsert key, oldest first.
     *
     * @param key key
     * @return copies
     */
    public List<Recommendation> findByKey(RecommendationKey key) {
        return snapshotOf(key.getInstanceId()).stream()
                .filter(r -> key.equals(r.key()))
                .sorted(Comparator.comparingLong(Recommendation::getId))
                .toList();
    }

    public Recommendation insert(Recommendation recommendation) {
        Recommendation stored = recommendation.toBuilder().id(ids.incrementAndGet()).build();
        List<Recommendation> list = byInstance.computeIfAbsent(stored.getInstanceId(), id -> new ArrayList<>());
        synchronized (list) {
            list.add(stored);
        }
        instanceById.put(stored.getId(), stored.getInstanceId());
        return stored.toBuilder().build();
    }

    public Recommendation update(Recommendation recommendation) {
        List<Recommendation> list = byInstance.get(recommendation.getInstanceId());
        if (list == null) {
            throw new IllegalStateException("No recommendations stored for instance " + recommendation.getInstanceId());
        }
        synchronized (list) {
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i).getId() == recommendation.getId()) {
                    list.set(i, recommendation.toBuilder().build());
                    return recommendation.toBuilder().build();
                }
            }
        }
        throw new IllegalStateException("Recommendation " + recommendation.getId() + " is not stored");
    }

    public Optional<Recommendation> find(long id) {
        Long instanceId = instanceById.get(id);
        if (instanceId == null) {
            return Optional.empty();
        }
        return snapshotOf(instanceId).stream().filter(r -> r.getId() == id).findFirst();
    }

    /**
     * Ranked by score, then newest first.
     *
     * @param instanceId optional instance filter
     * @param status optional status filter
     * @return copies
     */
    public List<Recommendation> list(Long instanceId, RecommendationStatus status) {
        List<Recommendation> out = new ArrayList<>();
        if (instanceId != null) {
            out.addAll(snapshotOf(instanceId));
        } else {
            for (Long id : byInstance.keySet()) {
                out.addAll(snapshotOf(id));
            }
        }
        return out.stream()
                .filter(r -> status == null || r.getStatus() == status)
                .sorted(RANKING)
                .toList();
    }

    private List<Recommendation> snapshotOf(long instanceId) {
        List<Recommendation> list = byInstance.get(instanceId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return list.stream().map(r -> r.toBuilder().build()).toList();
        }
    }
}
