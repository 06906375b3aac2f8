package com.existence.arbitration.event;

import com.existence.arbitration.core.model.BindingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Notification that a binding's canonical status changed or was arbitrated.
 *
 * @param eventId         unique id, used by transports for de-duplication
 * @param type            {@link BindingEventType#STATUS_CHANGED}, {@link BindingEventType#APPROVED}
 *                        or {@link BindingEventType#REJECTED}
 * @param previousStatus  status before the change, null for arbitration events
 * @param reason          free-text reason, set for rejections
 */
public record BindingEvent(
        String eventId,
        BindingEventType type,
        String scopeId,
        String bindingId,
        String linkedElementId,
        BindingStatus status,
        BindingStatus previousStatus,
        String actorId,
        String reason,
        Instant timestamp
) {
    public BindingEvent {
        Objects.requireNonNull(eventId, "eventId is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(bindingId, "bindingId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static BindingEvent statusChanged(String scopeId, String bindingId, String elementId,
                                             BindingStatus status, BindingStatus previousStatus,
                                             String actorId, String reason, Instant at) {
        return new BindingEvent(UUID.randomUUID().toString(), BindingEventType.STATUS_CHANGED, scopeId,
                bindingId, elementId, status, previousStatus, actorId, reason, at);
    }

    public static BindingEvent arbitrated(BindingEventType type, String scopeId, String bindingId,
                                          String elementId, BindingStatus status, String userId,
                                          String reason, Instant at) {
        if (type != BindingEventType.APPROVED && type != BindingEventType.REJECTED) {
            throw new IllegalArgumentException("Not an arbitration event type: " + type);
        }
        return new BindingEvent(UUID.randomUUID().toString(), type, scopeId, bindingId, elementId,
                status, null, userId, reason, at);
    }

    /**
     * Signals an external transport should emit for this event: the generic
     * status-changed signal followed by the status-specific ones.
     */
    public List<BindingEventType> signals() {
        if (type != BindingEventType.STATUS_CHANGED) {
            return List.of(type);
        }
        if (status == null) {
            return List.of(BindingEventType.STATUS_CHANGED);
        }
        switch (status) {
            case HIDDEN:
                return List.of(BindingEventType.STATUS_CHANGED, BindingEventType.HIDDEN);
            case DELETED:
                return List.of(BindingEventType.STATUS_CHANGED, BindingEventType.DELETED);
            case PENDING:
                return List.of(BindingEventType.STATUS_CHANGED, BindingEventType.PENDING);
            case VISIBLE:
                return previousStatus == BindingStatus.DELETED
                        ? List.of(BindingEventType.STATUS_CHANGED, BindingEventType.SHOWN, BindingEventType.RESTORED)
                        : List.of(BindingEventType.STATUS_CHANGED, BindingEventType.SHOWN);
            default:
                return List.of(BindingEventType.STATUS_CHANGED);
        }
    }
}
