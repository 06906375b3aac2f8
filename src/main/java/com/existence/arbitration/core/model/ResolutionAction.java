package com.existence.arbitration.core.model;

import java.util.Locale;

/**
 * How an inconsistency was closed.
 */
public enum ResolutionAction {
    APPROVED,
    REJECTED,
    AUTO_FIXED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
