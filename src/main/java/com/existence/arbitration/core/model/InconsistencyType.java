package com.existence.arbitration.core.model;

import java.util.Locale;

/**
 * Classification of a divergence between canonical status and projection signals.
 */
public enum InconsistencyType {
    /**
     * Neither projection knows the linked entities any more.
     */
    ORPHANED,
    MISSING_ELEMENT,
    MISSING_MARK,
    STATUS_MISMATCH,
    /**
     * The binding is visible on the canvas while its document mark is deleted.
     */
    GHOST_BINDING;

    /**
     * Hyphenated name, e.g. {@code status-mismatch}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
