package com.existence.arbitration.event;

/**
 * In-process subscriber to binding events, e.g. a reconciliation trigger or a
 * projection adapter that updates its decorations.
 */
@FunctionalInterface
public interface BindingEventListener {

    /**
     * Called synchronously on the publishing thread after the transition is persisted.
     */
    void onEvent(BindingEvent event);
}
