package com.existence.arbitration.store;

import com.existence.arbitration.core.ExistenceException;

/**
 * Thrown when a compare-and-swap status write finds that another writer
 * already changed the binding.
 */
public class StaleBindingVersionException extends ExistenceException {

    private final String bindingId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleBindingVersionException(String bindingId, long expectedVersion, long actualVersion) {
        super("Binding " + bindingId + " was modified concurrently: expected version "
                + expectedVersion + " but found " + actualVersion);
        this.bindingId = bindingId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getBindingId() {
        return bindingId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
