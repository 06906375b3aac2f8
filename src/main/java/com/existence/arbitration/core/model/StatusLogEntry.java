package com.existence.arbitration.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit record of one applied status transition.
 * Entries are append-only and never updated or removed.
 */
public record StatusLogEntry(
        String id,
        String bindingId,
        BindingStatus status,
        BindingStatus previousStatus,
        TransitionType transitionType,
        String reason,
        String actorId,
        ActorType actorType,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public StatusLogEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(bindingId, "bindingId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(transitionType, "transitionType is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        actorType = actorType != null ? actorType : ActorType.USER;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String bindingId;
        private BindingStatus status;
        private BindingStatus previousStatus;
        private TransitionType transitionType;
        private String reason;
        private String actorId;
        private ActorType actorType;
        private Instant timestamp = Instant.now();
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder bindingId(String bindingId) {
            this.bindingId = bindingId;
            return this;
        }

        public Builder status(BindingStatus status) {
            this.status = status;
            return this;
        }

        public Builder previousStatus(BindingStatus previousStatus) {
            this.previousStatus = previousStatus;
            return this;
        }

        public Builder transitionType(TransitionType transitionType) {
            this.transitionType = transitionType;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder actorType(ActorType actorType) {
            this.actorType = actorType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public StatusLogEntry build() {
            return new StatusLogEntry(id, bindingId, status, previousStatus, transitionType,
                    reason, actorId, actorType, timestamp, metadata);
        }
    }
}
