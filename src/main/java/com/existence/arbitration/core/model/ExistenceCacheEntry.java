package com.existence.arbitration.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Derived, non-authoritative existence snapshot for one binding.
 * May be discarded and rebuilt at any time; truth lives in the binding and its status log.
 */
public record ExistenceCacheEntry(
        String bindingId,
        BindingStatus status,
        boolean elementExists,
        boolean elementDeleted,
        boolean markExists,
        Instant lastVerifiedAt,
        long cacheVersion,
        boolean stale
) {
    public ExistenceCacheEntry {
        Objects.requireNonNull(bindingId, "bindingId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(lastVerifiedAt, "lastVerifiedAt is required");
    }

    /**
     * First entry for a binding, with existence flags derived from its status.
     */
    public static ExistenceCacheEntry initial(String bindingId, BindingStatus status, Instant at) {
        return new ExistenceCacheEntry(
                bindingId,
                status,
                true,
                status == BindingStatus.HIDDEN || status == BindingStatus.DELETED,
                status == BindingStatus.VISIBLE,
                at,
                1,
                false);
    }

    /**
     * Next version of this entry after a status change. Existence flags are kept as last observed.
     */
    public ExistenceCacheEntry next(BindingStatus newStatus, Instant at) {
        return new ExistenceCacheEntry(bindingId, newStatus, elementExists, elementDeleted, markExists,
                at, cacheVersion + 1, false);
    }

    public ExistenceCacheEntry markStale() {
        return new ExistenceCacheEntry(bindingId, status, elementExists, elementDeleted, markExists,
                lastVerifiedAt, cacheVersion, true);
    }
}
