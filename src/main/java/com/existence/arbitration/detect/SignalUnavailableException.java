package com.existence.arbitration.detect;

import com.existence.arbitration.core.ExistenceException;

/**
 * Thrown when a projection's existence signals cannot be read.
 * This is an infrastructure failure, unlike a detected divergence.
 */
public class SignalUnavailableException extends ExistenceException {

    public SignalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
