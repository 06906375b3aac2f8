package com.existence.arbitration.rest.dto;

import com.existence.arbitration.engine.TransitionResult;

/**
 * Response DTO for a single transition.
 */
public record TransitionResponse(
        String bindingId,
        String previousStatus,
        String status,
        boolean applied
) {
    public static TransitionResponse from(TransitionResult result) {
        return new TransitionResponse(
                result.bindingId(),
                result.previousStatus().wireName(),
                result.status().wireName(),
                result.applied()
        );
    }
}
