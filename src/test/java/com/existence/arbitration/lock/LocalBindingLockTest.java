package com.existence.arbitration.lock;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalBindingLockTest {

    @Test
    void lockIsReentrantForTheOwner() {
        LocalBindingLock lock = new LocalBindingLock(Duration.ofMillis(100));

        lock.lock("b1");
        lock.lock("b1");
        lock.unlock("b1");
        lock.unlock("b1");

        assertTrue(CompletableFuture.supplyAsync(() -> {
            lock.lock("b1");
            lock.unlock("b1");
            return true;
        }).join());
    }

    @Test
    void contendedLockTimesOut() throws Exception {
        LocalBindingLock lock = new LocalBindingLock(Duration.ofMillis(50));
        lock.lock("b1");
        try {
            CompletableFuture<Void> other = CompletableFuture.runAsync(() -> lock.lock("b1"));
            ExecutionException e = assertThrows(ExecutionException.class, () -> other.get(2, TimeUnit.SECONDS));
            assertInstanceOf(LockAcquisitionException.class, e.getCause());
        } finally {
            lock.unlock("b1");
        }
    }

    @Test
    void differentBindingsDoNotContend() throws Exception {
        LocalBindingLock lock = new LocalBindingLock(Duration.ofMillis(50));
        lock.lock("b1");
        try {
            CompletableFuture<Void> other = CompletableFuture.runAsync(() -> {
                lock.lock("b2");
                lock.unlock("b2");
            });
            assertDoesNotThrow(() -> other.get(2, TimeUnit.SECONDS));
        } finally {
            lock.unlock("b1");
        }
    }

    @Test
    void unlockByNonOwnerIsNoOp() {
        LocalBindingLock lock = new LocalBindingLock();
        assertDoesNotThrow(() -> lock.unlock("never-locked"));
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new LocalBindingLock(Duration.ZERO));
    }
}
