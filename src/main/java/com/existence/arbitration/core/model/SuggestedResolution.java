package com.existence.arbitration.core.model;

/**
 * Repair proposed for an inconsistency, expressed as the target status of the binding.
 */
public enum SuggestedResolution {
    SET_HIDDEN(BindingStatus.HIDDEN, "set status=hidden"),
    SET_VISIBLE(BindingStatus.VISIBLE, "set status=visible"),
    SOFT_DELETE(BindingStatus.DELETED, "soft-delete binding");

    private final BindingStatus targetStatus;
    private final String label;

    SuggestedResolution(BindingStatus targetStatus, String label) {
        this.targetStatus = targetStatus;
        this.label = label;
    }

    public BindingStatus targetStatus() {
        return targetStatus;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
