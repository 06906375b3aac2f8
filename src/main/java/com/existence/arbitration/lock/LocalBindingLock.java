package com.existence.arbitration.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-binding {@link ReentrantLock}s. This is the default lock implementation.
 */
public class LocalBindingLock implements BindingLock {
    private static final Logger log = LoggerFactory.getLogger(LocalBindingLock.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public LocalBindingLock() {
        this(DEFAULT_TIMEOUT);
    }

    public LocalBindingLock(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMs = timeout.toMillis();
    }

    @Override
    public void lock(String bindingId) {
        ReentrantLock lock = locks.computeIfAbsent(bindingId, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for binding '" + bindingId + "' within " + timeoutMs + "ms");
            }
            log.trace("Lock acquired: {}", bindingId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for binding: " + bindingId, e);
        }
    }

    @Override
    public void unlock(String bindingId) {
        ReentrantLock lock = locks.get(bindingId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("Lock released: {}", bindingId);
        }
    }
}
