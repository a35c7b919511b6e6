package com.pgokache.store;

import com.pgokache.model.SetupState;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current setup verdict per instance. Each save replaces the previous state whole.
 */
@Component
public class SetupStateStore {
    private final Map<Long, SetupState> states = new ConcurrentHashMap<>();

    public void save(SetupState state) {
        states.put(state.getInstanceId(), state);
    }

    public Optional<SetupState> find(long instanceId) {
        return Optional.ofNullable(states.get(instanceId));
    }

    public List<SetupState> list() {
        return states.values().stream()
                .sorted(Comparator.comparing(SetupState::getLastCheckedAt,
                        Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder())))
                .toList();
    }
}
