package com.existence.arbitration.engine;

import com.existence.arbitration.core.ExistenceException;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.TransitionType;

/**
 * Thrown by a strict {@link TransitionPolicy} when a transition is not in its table.
 */
public class IllegalTransitionException extends ExistenceException {

    private final BindingStatus from;
    private final BindingStatus to;
    private final TransitionType cause;

    public IllegalTransitionException(BindingStatus from, BindingStatus to, TransitionType cause) {
        super("Transition " + from.wireName() + " -> " + to.wireName()
                + " is not allowed for cause " + cause.wireName());
        this.from = from;
        this.to = to;
        this.cause = cause;
    }

    public BindingStatus getFrom() {
        return from;
    }

    public BindingStatus getTo() {
        return to;
    }

    public TransitionType getTransitionType() {
        return cause;
    }
}
