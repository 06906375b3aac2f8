package com.existence.arbitration.rest.dto;

import com.existence.arbitration.core.model.Inconsistency;

import java.time.Instant;

/**
 * Response DTO for a detected divergence between projections.
 */
public record InconsistencyResponse(
        String id,
        String bindingId,
        String type,
        Instant detectedAt,
        String bindingStatus,
        Boolean elementDeleted,
        Boolean markExists,
        String suggestedResolution,
        double resolutionConfidence,
        Instant resolvedAt,
        String resolvedBy,
        String resolutionAction,
        String resolutionNotes
) {
    public static InconsistencyResponse from(Inconsistency inconsistency) {
        return new InconsistencyResponse(
                inconsistency.getId(),
                inconsistency.getBindingId(),
                inconsistency.getType().wireName(),
                inconsistency.getDetectedAt(),
                inconsistency.getBindingStatus() != null ? inconsistency.getBindingStatus().wireName() : null,
                inconsistency.getElementDeleted(),
                inconsistency.getMarkExists(),
                inconsistency.getSuggestedResolution() != null
                        ? inconsistency.getSuggestedResolution().label() : null,
                inconsistency.getResolutionConfidence(),
                inconsistency.getResolvedAt(),
                inconsistency.getResolvedBy(),
                inconsistency.getResolutionAction() != null
                        ? inconsistency.getResolutionAction().wireName() : null,
                inconsistency.getResolutionNotes()
        );
    }
}
