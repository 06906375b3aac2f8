package com.existence.arbitration.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A detected divergence between a binding's canonical status and what the
 * projections report. Created by reconciliation; resolution fields stay null
 * until the finding is auto-fixed or arbitrated.
 */
public final class Inconsistency {

    public static final String DETECTED_BY_RECONCILIATION = "reconciliation";

    private final String id;
    private final String bindingId;
    private final InconsistencyType type;
    private final Instant detectedAt;
    private final String detectedBy;
    private final BindingStatus bindingStatus;
    private final Boolean elementDeleted;
    private final Boolean markExists;
    private final SuggestedResolution suggestedResolution;
    private final double resolutionConfidence;
    private final Instant resolvedAt;
    private final String resolvedBy;
    private final ResolutionAction resolutionAction;
    private final String resolutionNotes;
    private final Map<String, Object> snapshot;

    private Inconsistency(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.bindingId = Objects.requireNonNull(builder.bindingId, "bindingId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.detectedAt = builder.detectedAt != null ? builder.detectedAt : Instant.now();
        this.detectedBy = builder.detectedBy != null ? builder.detectedBy : DETECTED_BY_RECONCILIATION;
        this.bindingStatus = builder.bindingStatus;
        this.elementDeleted = builder.elementDeleted;
        this.markExists = builder.markExists;
        this.suggestedResolution = Objects.requireNonNull(builder.suggestedResolution,
                "suggestedResolution is required");
        this.resolutionConfidence = builder.resolutionConfidence;
        this.resolvedAt = builder.resolvedAt;
        this.resolvedBy = builder.resolvedBy;
        this.resolutionAction = builder.resolutionAction;
        this.resolutionNotes = builder.resolutionNotes;
        this.snapshot = builder.snapshot != null ? Map.copyOf(builder.snapshot) : Map.of();
        if (resolutionConfidence < 0.0 || resolutionConfidence > 1.0) {
            throw new IllegalArgumentException("resolutionConfidence must be in [0, 1]");
        }
    }

    public String getId() {
        return id;
    }

    public String getBindingId() {
        return bindingId;
    }

    public InconsistencyType getType() {
        return type;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getDetectedBy() {
        return detectedBy;
    }

    public BindingStatus getBindingStatus() {
        return bindingStatus;
    }

    public Boolean getElementDeleted() {
        return elementDeleted;
    }

    public Boolean getMarkExists() {
        return markExists;
    }

    public SuggestedResolution getSuggestedResolution() {
        return suggestedResolution;
    }

    public double getResolutionConfidence() {
        return resolutionConfidence;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public ResolutionAction getResolutionAction() {
        return resolutionAction;
    }

    public String getResolutionNotes() {
        return resolutionNotes;
    }

    public Map<String, Object> getSnapshot() {
        return snapshot;
    }

    public boolean isOpen() {
        return resolvedAt == null;
    }

    /**
     * Returns a resolved copy of this finding.
     */
    public Inconsistency resolved(ResolutionAction action, String resolvedBy, String notes, Instant at) {
        return toBuilder()
                .resolvedAt(at)
                .resolvedBy(resolvedBy)
                .resolutionAction(action)
                .resolutionNotes(notes)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .bindingId(bindingId)
                .type(type)
                .detectedAt(detectedAt)
                .detectedBy(detectedBy)
                .bindingStatus(bindingStatus)
                .elementDeleted(elementDeleted)
                .markExists(markExists)
                .suggestedResolution(suggestedResolution)
                .resolutionConfidence(resolutionConfidence)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy)
                .resolutionAction(resolutionAction)
                .resolutionNotes(resolutionNotes)
                .snapshot(snapshot);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Inconsistency that = (Inconsistency) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Inconsistency{" +
                "id='" + id + '\'' +
                ", bindingId='" + bindingId + '\'' +
                ", type=" + type.wireName() +
                ", confidence=" + resolutionConfidence +
                ", suggested='" + suggestedResolution.label() + '\'' +
                ", resolved=" + (resolutionAction != null ? resolutionAction.wireName() : "no") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String bindingId;
        private InconsistencyType type;
        private Instant detectedAt;
        private String detectedBy;
        private BindingStatus bindingStatus;
        private Boolean elementDeleted;
        private Boolean markExists;
        private SuggestedResolution suggestedResolution;
        private double resolutionConfidence;
        private Instant resolvedAt;
        private String resolvedBy;
        private ResolutionAction resolutionAction;
        private String resolutionNotes;
        private Map<String, Object> snapshot;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder bindingId(String bindingId) {
            this.bindingId = bindingId;
            return this;
        }

        public Builder type(InconsistencyType type) {
            this.type = type;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder detectedBy(String detectedBy) {
            this.detectedBy = detectedBy;
            return this;
        }

        public Builder bindingStatus(BindingStatus bindingStatus) {
            this.bindingStatus = bindingStatus;
            return this;
        }

        public Builder elementDeleted(Boolean elementDeleted) {
            this.elementDeleted = elementDeleted;
            return this;
        }

        public Builder markExists(Boolean markExists) {
            this.markExists = markExists;
            return this;
        }

        public Builder suggestedResolution(SuggestedResolution suggestedResolution) {
            this.suggestedResolution = suggestedResolution;
            return this;
        }

        public Builder resolutionConfidence(double resolutionConfidence) {
            this.resolutionConfidence = resolutionConfidence;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolutionAction(ResolutionAction resolutionAction) {
            this.resolutionAction = resolutionAction;
            return this;
        }

        public Builder resolutionNotes(String resolutionNotes) {
            this.resolutionNotes = resolutionNotes;
            return this;
        }

        public Builder snapshot(Map<String, Object> snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public Inconsistency build() {
            return new Inconsistency(this);
        }
    }
}
