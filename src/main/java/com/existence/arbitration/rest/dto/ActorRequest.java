package com.existence.arbitration.rest.dto;

/**
 * Request body naming who performs a user or arbitration action.
 */
public record ActorRequest(String actorId) {
    public ActorRequest {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId is required");
        }
    }
}
