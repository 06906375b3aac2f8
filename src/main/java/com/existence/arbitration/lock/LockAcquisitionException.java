package com.existence.arbitration.lock;

import com.existence.arbitration.core.ExistenceException;

/**
 * Runtime exception thrown when a binding lock cannot be acquired within the configured timeout.
 */
public class LockAcquisitionException extends ExistenceException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
