package com.existence.arbitration.core.model;

/**
 * Existence signal reported by a projection for one of its own entities.
 */
public enum EntityState {
    /**
     * The entity exists and is not flagged as deleted.
     */
    PRESENT,

    /**
     * The entity row exists but the projection flags it as deleted.
     */
    DELETED,

    /**
     * The projection has no record of the entity at all.
     */
    ABSENT
}
