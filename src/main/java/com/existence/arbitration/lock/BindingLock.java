package com.existence.arbitration.lock;

/**
 * Serializes writers on a single binding within one engine instance.
 */
public interface BindingLock {

    /**
     * Acquires the lock for a binding, waiting up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    void lock(String bindingId);

    /**
     * Releases a lock held by the current thread; a no-op otherwise.
     */
    void unlock(String bindingId);
}
