package com.existence.arbitration.store;

import com.existence.arbitration.api.Page;
import com.existence.arbitration.api.PageRequest;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.ResolutionAction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for findings produced by reconciliation runs.
 * Findings are inserted once and only their resolution fields change afterwards.
 */
public interface InconsistencyRepository {

    Inconsistency save(Inconsistency inconsistency);

    Optional<Inconsistency> findById(String id);

    /**
     * Gets every finding recorded for a binding, oldest first.
     */
    List<Inconsistency> findByBindingId(String bindingId);

    /**
     * Gets the unresolved findings for a binding, oldest first.
     */
    List<Inconsistency> findOpenByBindingId(String bindingId);

    /**
     * Gets the most recently detected unresolved finding for a binding.
     */
    default Optional<Inconsistency> findLatestOpen(String bindingId) {
        List<Inconsistency> open = findOpenByBindingId(bindingId);
        return open.isEmpty() ? Optional.empty() : Optional.of(open.get(open.size() - 1));
    }

    /**
     * Gets unresolved findings across all bindings, oldest first.
     */
    List<Inconsistency> findAllOpen();

    default Page<Inconsistency> findOpen(PageRequest page) {
        return Page.of(findAllOpen(), page);
    }

    /**
     * Marks a finding resolved.
     *
     * @return the resolved finding
     * @throws IllegalArgumentException if no finding with this id exists
     */
    Inconsistency resolve(String id, ResolutionAction action, String resolvedBy, String notes, Instant at);

    long countOpen();

    int count();
}
