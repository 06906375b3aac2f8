package com.existence.arbitration.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical link between a canvas element (projection A) and a document block/mark
 * (projection B), scoped to a canvas container.
 *
 * <p>{@link #getCurrentStatus()} is the only authoritative existence signal.
 * Instances are immutable; a status change produces a new instance with an
 * incremented {@link #getVersion() version}, which stores use as an optimistic
 * concurrency token.</p>
 */
public final class Binding {
    private final String id;
    private final String containerId;
    private final String documentId;
    private final String linkedElementId;
    private final String linkedBlockId;
    private final String linkedMarkId;
    private final BindingStatus currentStatus;
    private final Instant statusUpdatedAt;
    private final String statusUpdatedBy;
    private final Provenance provenance;
    private final double provenanceConfidence;
    private final long version;
    private final Instant createdAt;

    private Binding(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.containerId = Objects.requireNonNull(builder.containerId, "containerId is required");
        this.documentId = builder.documentId;
        this.linkedElementId = builder.linkedElementId;
        this.linkedBlockId = builder.linkedBlockId;
        this.linkedMarkId = builder.linkedMarkId;
        this.currentStatus = builder.currentStatus != null ? builder.currentStatus : BindingStatus.VISIBLE;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.statusUpdatedAt = builder.statusUpdatedAt != null ? builder.statusUpdatedAt : this.createdAt;
        this.statusUpdatedBy = builder.statusUpdatedBy;
        this.provenance = builder.provenance != null ? builder.provenance : Provenance.USER;
        this.provenanceConfidence = builder.provenanceConfidence;
        this.version = builder.version;
        if (provenanceConfidence < 0.0 || provenanceConfidence > 1.0) {
            throw new IllegalArgumentException("provenanceConfidence must be in [0, 1]");
        }
    }

    public String getId() {
        return id;
    }

    public String getContainerId() {
        return containerId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getLinkedElementId() {
        return linkedElementId;
    }

    public String getLinkedBlockId() {
        return linkedBlockId;
    }

    public String getLinkedMarkId() {
        return linkedMarkId;
    }

    /**
     * Key under which projection B reports the existence of this binding's mark:
     * the mark id when one is recorded, otherwise the block id.
     */
    public String getMarkKey() {
        return linkedMarkId != null ? linkedMarkId : linkedBlockId;
    }

    public BindingStatus getCurrentStatus() {
        return currentStatus;
    }

    public Instant getStatusUpdatedAt() {
        return statusUpdatedAt;
    }

    public String getStatusUpdatedBy() {
        return statusUpdatedBy;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public double getProvenanceConfidence() {
        return provenanceConfidence;
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isTombstone() {
        return currentStatus == BindingStatus.DELETED;
    }

    /**
     * Returns a copy carrying the new status, the actor and time of the change, and the next version.
     */
    public Binding withStatus(BindingStatus status, String actorId, Instant at) {
        return builder(this)
                .currentStatus(status)
                .statusUpdatedBy(actorId)
                .statusUpdatedAt(at)
                .version(version + 1)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding binding = (Binding) o;
        return Objects.equals(id, binding.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Binding{" +
                "id='" + id + '\'' +
                ", containerId='" + containerId + '\'' +
                ", elementId='" + linkedElementId + '\'' +
                ", blockId='" + linkedBlockId + '\'' +
                ", status=" + currentStatus +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Binding binding) {
        return new Builder()
                .id(binding.id)
                .containerId(binding.containerId)
                .documentId(binding.documentId)
                .linkedElementId(binding.linkedElementId)
                .linkedBlockId(binding.linkedBlockId)
                .linkedMarkId(binding.linkedMarkId)
                .currentStatus(binding.currentStatus)
                .statusUpdatedAt(binding.statusUpdatedAt)
                .statusUpdatedBy(binding.statusUpdatedBy)
                .provenance(binding.provenance)
                .provenanceConfidence(binding.provenanceConfidence)
                .version(binding.version)
                .createdAt(binding.createdAt);
    }

    public static class Builder {
        private String id;
        private String containerId;
        private String documentId;
        private String linkedElementId;
        private String linkedBlockId;
        private String linkedMarkId;
        private BindingStatus currentStatus;
        private Instant statusUpdatedAt;
        private String statusUpdatedBy;
        private Provenance provenance;
        private double provenanceConfidence = 1.0;
        private long version;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder containerId(String containerId) {
            this.containerId = containerId;
            return this;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder linkedElementId(String linkedElementId) {
            this.linkedElementId = linkedElementId;
            return this;
        }

        public Builder linkedBlockId(String linkedBlockId) {
            this.linkedBlockId = linkedBlockId;
            return this;
        }

        public Builder linkedMarkId(String linkedMarkId) {
            this.linkedMarkId = linkedMarkId;
            return this;
        }

        public Builder currentStatus(BindingStatus currentStatus) {
            this.currentStatus = currentStatus;
            return this;
        }

        public Builder statusUpdatedAt(Instant statusUpdatedAt) {
            this.statusUpdatedAt = statusUpdatedAt;
            return this;
        }

        public Builder statusUpdatedBy(String statusUpdatedBy) {
            this.statusUpdatedBy = statusUpdatedBy;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder provenanceConfidence(double provenanceConfidence) {
            this.provenanceConfidence = provenanceConfidence;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Binding build() {
            return new Binding(this);
        }
    }
}
