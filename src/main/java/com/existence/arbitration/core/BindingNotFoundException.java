package com.existence.arbitration.core;

/**
 * Thrown when an operation targets a binding that is not known to the engine's index or store.
 */
public class BindingNotFoundException extends ExistenceException {

    private final String bindingId;

    public BindingNotFoundException(String bindingId) {
        super("Unknown binding: " + bindingId);
        this.bindingId = bindingId;
    }

    public String getBindingId() {
        return bindingId;
    }
}
