package com.existence.arbitration.store;

import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.ResolutionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link InconsistencyRepository}.
 * Insertion order is kept so findings with equal detection times stay ordered.
 */
public class InMemoryInconsistencyRepository implements InconsistencyRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryInconsistencyRepository.class);

    private final ConcurrentMap<String, Stored> findings = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Inconsistency save(Inconsistency inconsistency) {
        findings.put(inconsistency.getId(), new Stored(sequence.incrementAndGet(), inconsistency));
        log.debug("Recorded inconsistency {} type={} binding={}",
                inconsistency.getId(), inconsistency.getType().wireName(), inconsistency.getBindingId());
        return inconsistency;
    }

    @Override
    public Optional<Inconsistency> findById(String id) {
        Stored stored = findings.get(id);
        return stored != null ? Optional.of(stored.value()) : Optional.empty();
    }

    @Override
    public List<Inconsistency> findByBindingId(String bindingId) {
        return findings.values().stream()
                .filter(s -> bindingId.equals(s.value().getBindingId()))
                .sorted(Comparator.comparingLong(Stored::seq))
                .map(Stored::value)
                .toList();
    }

    @Override
    public List<Inconsistency> findOpenByBindingId(String bindingId) {
        return findByBindingId(bindingId).stream()
                .filter(Inconsistency::isOpen)
                .toList();
    }

    @Override
    public List<Inconsistency> findAllOpen() {
        return findings.values().stream()
                .filter(s -> s.value().isOpen())
                .sorted(Comparator.comparingLong(Stored::seq))
                .map(Stored::value)
                .toList();
    }

    @Override
    public Inconsistency resolve(String id, ResolutionAction action, String resolvedBy, String notes, Instant at) {
        Stored updated = findings.computeIfPresent(id, (key, stored) ->
                new Stored(stored.seq(), stored.value().resolved(action, resolvedBy, notes, at)));
        if (updated == null) {
            throw new IllegalArgumentException("Inconsistency not found: " + id);
        }
        log.info("Inconsistency {} resolved action={} by {}", id, action.wireName(), resolvedBy);
        return updated.value();
    }

    @Override
    public long countOpen() {
        return findings.values().stream().filter(s -> s.value().isOpen()).count();
    }

    @Override
    public int count() {
        return findings.size();
    }

    private record Stored(long seq, Inconsistency value) {}
}
