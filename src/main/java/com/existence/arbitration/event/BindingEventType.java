package com.existence.arbitration.event;

/**
 * Signals published for binding changes. {@link #STATUS_CHANGED} accompanies every
 * applied transition; the others are status-specific sugar for external layers.
 */
public enum BindingEventType {
    STATUS_CHANGED("status-changed"),
    HIDDEN("hidden"),
    SHOWN("shown"),
    DELETED("deleted"),
    RESTORED("restored"),
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String signalName;

    BindingEventType(String signalName) {
        this.signalName = signalName;
    }

    /**
     * Name used by external transports, e.g. {@code binding:hidden}.
     */
    public String signalName() {
        return "binding:" + signalName;
    }
}
