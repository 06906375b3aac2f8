package com.existence.arbitration.engine;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.TransitionType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a status transition may be applied.
 *
 * <p>The default {@link #permissive()} policy lets every state reach every other state;
 * causes are recorded for audit only. {@link #strict()} enforces an explicit table.</p>
 */
@FunctionalInterface
public interface TransitionPolicy {

    /**
     * @throws IllegalTransitionException if the transition is not allowed
     */
    void check(BindingStatus from, BindingStatus to, TransitionType cause);

    static TransitionPolicy permissive() {
        return (from, to, cause) -> { };
    }

    /**
     * Tightened semantics:
     * <ul>
     *   <li>a tombstone only leaves {@code deleted} by becoming visible through
     *       {@code user_restore}, arbitration, or reconciliation;</li>
     *   <li>{@code arbitration_approve} and {@code arbitration_reject} require a pending binding.</li>
     * </ul>
     */
    static TransitionPolicy strict() {
        Set<TransitionType> tombstoneExits = EnumSet.of(
                TransitionType.USER_RESTORE,
                TransitionType.ARBITRATION_APPROVE,
                TransitionType.SYSTEM_RECONCILE);
        return (from, to, cause) -> {
            if (cause.isArbitration() && from != BindingStatus.PENDING) {
                throw new IllegalTransitionException(from, to, cause);
            }
            if (from == BindingStatus.DELETED
                    && (to != BindingStatus.VISIBLE || !tombstoneExits.contains(cause))) {
                throw new IllegalTransitionException(from, to, cause);
            }
        };
    }
}
