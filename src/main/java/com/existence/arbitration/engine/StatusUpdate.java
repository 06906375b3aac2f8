package com.existence.arbitration.engine;

import com.existence.arbitration.core.model.BindingStatus;

import java.util.Objects;

/**
 * One item of an explicit batch status update.
 */
public record StatusUpdate(String bindingId, BindingStatus status) {

    public StatusUpdate {
        Objects.requireNonNull(bindingId, "bindingId is required");
        Objects.requireNonNull(status, "status is required");
    }
}
