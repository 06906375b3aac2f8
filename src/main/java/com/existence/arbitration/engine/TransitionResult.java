package com.existence.arbitration.engine;

import com.existence.arbitration.core.model.BindingStatus;

/**
 * Outcome of a transition request.
 *
 * @param applied false when the binding was already in the requested status
 */
public record TransitionResult(String bindingId, BindingStatus previousStatus, BindingStatus status,
                               boolean applied) {

    static TransitionResult skipped(String bindingId, BindingStatus status) {
        return new TransitionResult(bindingId, status, status, false);
    }
}
