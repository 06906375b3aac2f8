package com.existence.arbitration.event;

/**
 * The single notification capability injected into the engine.
 * Adapters translate events to whatever transport the host uses.
 * Delivery is best-effort; implementations must not throw for transport failures.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(BindingEvent event);

    /**
     * Publisher that drops every event.
     */
    static EventPublisher noOp() {
        return event -> { };
    }
}
