package com.existence.arbitration.core;

/**
 * Base class for failures raised by the existence arbitration engine.
 * Divergences found during reconciliation are data, never exceptions.
 */
public class ExistenceException extends RuntimeException {

    public ExistenceException(String message) {
        super(message);
    }

    public ExistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
