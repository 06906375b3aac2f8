package com.existence.arbitration.core.model;

import java.util.Locale;

/**
 * Cause of a status transition, recorded in the status log.
 * Causes are informational; they do not restrict which transitions are allowed
 * unless a strict {@code TransitionPolicy} is configured.
 */
public enum TransitionType {
    USER_HIDE,
    USER_SHOW,
    USER_DELETE,
    USER_RESTORE,
    SYSTEM_RECONCILE,
    ARBITRATION_APPROVE,
    ARBITRATION_REJECT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isArbitration() {
        return this == ARBITRATION_APPROVE || this == ARBITRATION_REJECT;
    }
}
