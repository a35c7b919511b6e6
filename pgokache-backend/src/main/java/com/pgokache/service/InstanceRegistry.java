package com.pgokache.service;

import com.pgokache.api.InstancePatchRequest;
import com.pgokache.api.InstanceRequest;
import com.pgokache.error.InstanceNotFoundException;
import com.pgokache.error.ValidationException;
import com.pgokache.model.ConnectionDescriptor;
import com.pgokache.model.Instance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of monitored instances.
 *
 * <p>Passwords are held encrypted by {@link CredentialCipher} and only decrypted into a
 * {@link ConnectionDescriptor} when a caller is about to connect.
 */
@Slf4j
@Service
public class InstanceRegistry {
    private final Map<Long, Instance> instances = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private final CredentialCipher cipher;

    public InstanceRegistry(CredentialCipher cipher) {
        this.cipher = cipher;
    }

    public Instance create(InstanceRequest request) {
        Instance instance = Instance.builder()
                .id(ids.incrementAndGet())
                .name(request.getName().trim())
                .host(request.getHost().trim())
                .port(request.getPort() > 0 ? request.getPort() : 5432)
                .dbname(request.getDbname())
                .user(request.getUser())
                .sslMode(request.getSslMode() != null ? request.getSslMode() : "prefer")
                .createdAt(OffsetDateTime.now())
                .passwordEnc(cipher.encrypt(request.getPassword()))
                .build();
        instances.put(instance.getId(), instance);
        log.info("Registered instance: id={}, host={}, port={}, dbname={}",
                instance.getId(), instance.getHost(), instance.getPort(), instance.getDbname());
        return instance;
    }

    /**
     * Instances ordered newest first.
     *
     * @return instances
     */
    public List<Instance> list() {
        return instances.values().stream()
                .sorted(Comparator.comparing(Instance::getCreatedAt).reversed()
                        .thenComparing(Comparator.comparingLong(Instance::getId).reversed()))
                .toList();
    }

    public Optional<Instance> find(long id) {
        return Optional.ofNullable(instances.get(id));
    }

    public Instance get(long id) {
        return find(id).orElseThrow(() -> new InstanceNotFoundException(id));
    }

    /**
     * Apply a partial update. Only the display name and password are mutable.
     *
     * @param id instance id
     * @param patch requested changes
     * @return updated instance
     */
    public Instance patch(long id, InstancePatchRequest patch) {
        if (!patch.getImmutableFields().isEmpty()) {
            throw new ValidationException("Only name and password can be changed; rejected fields: "
                    + String.join(", ", patch.getImmutableFields()) + ".");
        }
        Instance updated = instances.computeIfPresent(id, (key, current) -> {
            Instance.InstanceBuilder builder = current.toBuilder();
            if (patch.getName() != null) {
                builder.name(patch.getName().trim());
            }
            if (patch.getPassword() != null) {
                builder.passwordEnc(cipher.encrypt(patch.getPassword()));
            }
            return builder.build();
        });
        if (updated == null) {
            throw new InstanceNotFoundException(id);
        }
        if (patch.getPassword() != null) {
            log.info("Rotated credentials for instance: id={}", id);
        }
        return updated;
    }

    /**
     * Decrypts the saved password into a one-shot connection descriptor.
     *
     * @param id instance id
     * @return descriptor
     */
    public ConnectionDescriptor describe(long id) {
        Instance instance = get(id);
        return ConnectionDescriptor.builder()
                .instanceId(instance.getId())
                .host(instance.getHost())
                .port(instance.getPort())
                .dbname(instance.getDbname())
                .user(instance.getUser())
                .password(cipher.decrypt(instance.getPasswordEnc()))
                .sslMode(instance.getSslMode())
                .build();
    }
}
