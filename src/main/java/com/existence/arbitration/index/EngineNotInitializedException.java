package com.existence.arbitration.index;

import com.existence.arbitration.core.ExistenceException;

/**
 * Thrown when a query or transition arrives before the scope index has been loaded.
 */
public class EngineNotInitializedException extends ExistenceException {

    public EngineNotInitializedException() {
        super("Existence index is not initialized; call initialize(scopeId) first");
    }
}
