package com.existence.arbitration.rest.dto;

import com.existence.arbitration.core.model.StatusLogEntry;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for one status history row.
 */
public record StatusLogResponse(
        String id,
        String status,
        String previousStatus,
        String transitionType,
        String reason,
        String actorId,
        String actorType,
        Instant timestamp
) {
    public static StatusLogResponse from(StatusLogEntry entry) {
        return new StatusLogResponse(
                entry.id(),
                entry.status().wireName(),
                entry.previousStatus() != null ? entry.previousStatus().wireName() : null,
                entry.transitionType().wireName(),
                entry.reason(),
                entry.actorId(),
                entry.actorType().name().toLowerCase(Locale.ROOT),
                entry.timestamp()
        );
    }
}
