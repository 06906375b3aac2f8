package com.existence.arbitration.store;

import com.existence.arbitration.core.BindingNotFoundException;
import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.StatusLogEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link StatusStore}.
 * Thread-safe; the version check and the status write happen atomically per binding.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryStatusStore implements StatusStore {

    private final ConcurrentMap<String, Binding> bindings = new ConcurrentHashMap<>();
    private final List<StatusLogEntry> log = new CopyOnWriteArrayList<>();

    @Override
    public Binding insert(Binding binding) {
        Binding existing = bindings.putIfAbsent(binding.getId(), binding);
        if (existing != null) {
            throw new IllegalStateException("Binding already exists: " + binding.getId());
        }
        return binding;
    }

    @Override
    public Optional<Binding> findById(String bindingId) {
        return Optional.ofNullable(bindings.get(bindingId));
    }

    @Override
    public List<Binding> findByContainerId(String containerId) {
        return bindings.values().stream()
                .filter(b -> containerId.equals(b.getContainerId()))
                .sorted(Comparator.comparing(Binding::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public Binding compareAndSetStatus(String bindingId, long expectedVersion, BindingStatus newStatus,
                                       String actorId, Instant at) {
        Binding updated = bindings.computeIfPresent(bindingId, (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                throw new StaleBindingVersionException(id, expectedVersion, current.getVersion());
            }
            return current.withStatus(newStatus, actorId, at);
        });
        if (updated == null) {
            throw new BindingNotFoundException(bindingId);
        }
        return updated;
    }

    @Override
    public StatusLogEntry append(StatusLogEntry entry) {
        log.add(entry);
        return entry;
    }

    @Override
    public List<StatusLogEntry> findLogByBindingId(String bindingId) {
        return log.stream()
                .filter(e -> bindingId.equals(e.bindingId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<StatusLogEntry> findLogByActorId(String actorId) {
        return log.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<StatusLogEntry> findLogBetween(Instant start, Instant end) {
        return log.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    @Override
    public int countLogEntries() {
        return log.size();
    }

    /**
     * Gets every audit row (immutable view).
     */
    public List<StatusLogEntry> findAllLogEntries() {
        return Collections.unmodifiableList(new ArrayList<>(log));
    }
}
