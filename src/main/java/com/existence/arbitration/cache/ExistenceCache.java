package com.existence.arbitration.cache;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ExistenceCacheEntry;

import java.util.Optional;

/**
 * Derived per-binding existence snapshot, recomputed on every transition.
 * Entries are non-authoritative: dropping any or all of them loses no truth.
 */
public interface ExistenceCache {

    Optional<ExistenceCacheEntry> get(String bindingId);

    /**
     * Inserts a first entry for the binding or bumps the existing one to the new status.
     *
     * @return the entry now cached
     */
    ExistenceCacheEntry upsert(String bindingId, BindingStatus status);

    /**
     * Flags every entry as stale without dropping it, e.g. before a scope refresh.
     */
    void markAllStale();

    void invalidate(String bindingId);

    void invalidateAll();

    CacheStats getStats();
}
