package com.pgokache.store;

import com.pgokache.model.QueryStat;
import com.pgokache.model.Snapshot;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only snapshot history per instance. Snapshots are never replaced or removed here;
 * retention is an external concern.
 */
@Component
public class SnapshotStore {
    private final Map<Long, List<Snapshot>> byInstance = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    /**
     * Store all rows as one new snapshot.
     *
     * @param instanceId instance id
     * @param capturedAt capture time
     * @param rows complete row set
     * @return stored snapshot
     */
    public Snapshot save(long instanceId, OffsetDateTime capturedAt, List<QueryStat> rows) {
        Snapshot snapshot = Snapshot.builder()
                .id(ids.incrementAndGet())
                .instanceId(instanceId)
                .capturedAt(capturedAt)
                .queryStats(rows)
                .build();
        List<Snapshot> history = byInstance.computeIfAbsent(instanceId, id -> new ArrayList<>());
        synchronized (history) {
            history.add(snapshot);
            history.sort(Comparator.comparing(Snapshot::getCapturedAt).thenComparingLong(Snapshot::getId));
        }
        return snapshot;
    }

    public Optional<Snapshot> latest(long instanceId) {
        List<Snapshot> recent = recent(instanceId, 1);
        return recent.isEmpty() ? Optional.empty() : Optional.of(recent.get(0));
    }

    /**
     * Most recent snapshots of an instance, newest first.
     *
     * @param instanceId instance id
     * @param count max snapshots
     * @return snapshots
     */
    public List<Snapshot> recent(long instanceId, int count) {
        List<Snapshot> history = byInstance.get(instanceId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            List<Snapshot> out = new ArrayList<>();
            for (int i = history.size() - 1; i >= 0 && out.size() < count; i--) {
                out.add(history.get(i));
            }
            return out;
        }
    }

    public List<Snapshot> latestPerInstance() {
        List<Snapshot> out = new ArrayList<>();
        for (Long instanceId : byInstance.keySet()) {
            latest(instanceId).ifPresent(out::add);
        }
        out.sort(Comparator.comparing(Snapshot::getCapturedAt).reversed());
        return out;
    }

    public int count(long instanceId) {
        List<Snapshot> history = byInstance.get(instanceId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }
}
