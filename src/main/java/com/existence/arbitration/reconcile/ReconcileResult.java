package com.existence.arbitration.reconcile;

import com.existence.arbitration.core.model.Inconsistency;

import java.util.List;

/**
 * Summary of one reconciliation pass.
 *
 * @param autoFixed           findings repaired automatically
 * @param requiresHumanReview findings demoted to pending or whose auto-fix failed
 * @param inconsistencies     every finding of the pass, as persisted
 */
public record ReconcileResult(String scopeId, int autoFixed, int requiresHumanReview,
                              List<Inconsistency> inconsistencies) {

    public ReconcileResult {
        inconsistencies = inconsistencies != null ? List.copyOf(inconsistencies) : List.of();
    }

    public int total() {
        return inconsistencies.size();
    }
}
