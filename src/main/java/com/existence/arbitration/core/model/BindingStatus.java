package com.existence.arbitration.core.model;

import java.util.Locale;

/**
 * Canonical existence status of a binding.
 * Bindings are never physically removed; {@link #DELETED} is a tombstone
 * that {@code restore} can revive.
 */
public enum BindingStatus {
    /**
     * Both projections render the link.
     */
    VISIBLE,

    /**
     * The link exists but is hidden, typically because the canvas element was deleted.
     */
    HIDDEN,

    /**
     * Soft-deleted tombstone, retained for audit and restore.
     */
    DELETED,

    /**
     * Awaiting human arbitration.
     */
    PENDING;

    /**
     * Lower-case name used on the wire and in audit rows.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BindingStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return BindingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
