package com.existence.arbitration.rest.dto;

import java.util.List;

/**
 * Request DTO for hiding or showing the bindings of canvas elements.
 *
 * @param elementIds canvas element ids, unmapped ids are ignored
 * @param actorId    user performing the change
 */
public record ElementIdsRequest(
        List<String> elementIds,
        String actorId
) {
    public ElementIdsRequest {
        if (elementIds == null || elementIds.isEmpty()) {
            throw new IllegalArgumentException("elementIds must not be empty");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId is required");
        }
        elementIds = List.copyOf(elementIds);
    }
}
