package com.existence.arbitration.rest.dto;

import com.existence.arbitration.reconcile.ReconcileResult;

import java.util.List;

/**
 * Response DTO for a reconciliation pass.
 */
public record ReconcileResponse(
        String scopeId,
        int autoFixed,
        int requiresHumanReview,
        int total,
        List<InconsistencyResponse> inconsistencies
) {
    public static ReconcileResponse from(ReconcileResult result) {
        return new ReconcileResponse(
                result.scopeId(),
                result.autoFixed(),
                result.requiresHumanReview(),
                result.total(),
                result.inconsistencies().stream().map(InconsistencyResponse::from).toList()
        );
    }
}
