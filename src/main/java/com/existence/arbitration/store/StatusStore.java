package com.existence.arbitration.store;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.StatusLogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for binding records and their append-only status log.
 * All writes are scoped to a single binding; there is no cross-binding transaction.
 * Implementations provide different storage backends.
 */
public interface StatusStore {

    /**
     * Inserts a newly established binding.
     *
     * @throws IllegalStateException if a binding with the same id already exists
     */
    Binding insert(Binding binding);

    Optional<Binding> findById(String bindingId);

    /**
     * Gets all bindings of a container (canvas), including tombstones.
     */
    List<Binding> findByContainerId(String containerId);

    /**
     * Writes a new status if the stored version still equals {@code expectedVersion}.
     *
     * @return the stored binding carrying the new status and the next version
     * @throws com.existence.arbitration.core.BindingNotFoundException if the binding does not exist
     * @throws StaleBindingVersionException if another writer got there first
     */
    Binding compareAndSetStatus(String bindingId, long expectedVersion, BindingStatus newStatus,
                                String actorId, Instant at);

    /**
     * Appends an audit row. Rows are never updated or removed.
     */
    StatusLogEntry append(StatusLogEntry entry);

    /**
     * Gets the status history of a binding in append order.
     */
    List<StatusLogEntry> findLogByBindingId(String bindingId);

    List<StatusLogEntry> findLogByActorId(String actorId);

    List<StatusLogEntry> findLogBetween(Instant start, Instant end);

    int countLogEntries();
}
