package com.existence.arbitration.api;

import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.reconcile.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Asynchronous view of an {@link ExistenceEngine}.
 * Calls run on a bounded daemon pool and fail with a {@link java.util.concurrent.TimeoutException}
 * after the configured timeout.
 */
public class AsyncExistenceEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncExistenceEngine.class);

    private static final int DEFAULT_POOL_SIZE = Math.max(2, Runtime.getRuntime().availableProcessors());

    private final ExistenceEngine engine;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncExistenceEngine(ExistenceEngine engine, long timeoutMs) {
        this(engine, timeoutMs, DEFAULT_POOL_SIZE);
    }

    public AsyncExistenceEngine(ExistenceEngine engine, long timeoutMs, int poolSize) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.engine = engine;
        this.timeoutMs = timeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "existence-async-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Integer> initializeAsync(String scopeId) {
        return submit(() -> engine.initialize(scopeId));
    }

    public CompletableFuture<TransitionResult> hideAsync(String bindingId, String actorId) {
        return submit(() -> engine.hide(bindingId, actorId));
    }

    public CompletableFuture<TransitionResult> showAsync(String bindingId, String actorId) {
        return submit(() -> engine.show(bindingId, actorId));
    }

    public CompletableFuture<TransitionResult> softDeleteAsync(String bindingId, String actorId) {
        return submit(() -> engine.softDelete(bindingId, actorId));
    }

    public CompletableFuture<TransitionResult> restoreAsync(String bindingId, String actorId) {
        return submit(() -> engine.restore(bindingId, actorId));
    }

    public CompletableFuture<Integer> hideByElementIdsAsync(List<String> elementIds, String actorId) {
        return submit(() -> engine.hideByElementIds(elementIds, actorId));
    }

    public CompletableFuture<Integer> showByElementIdsAsync(List<String> elementIds, String actorId) {
        return submit(() -> engine.showByElementIds(elementIds, actorId));
    }

    public CompletableFuture<ReconcileResult> reconcileAsync(boolean autoFix) {
        return submit(() -> engine.reconcile(autoFix));
    }

    public CompletableFuture<TransitionResult> approveAsync(String bindingId, String userId) {
        return submit(() -> engine.approve(bindingId, userId));
    }

    public CompletableFuture<TransitionResult> rejectAsync(String bindingId, String userId, String reason) {
        return submit(() -> engine.reject(bindingId, userId, reason));
    }

    private <T> CompletableFuture<T> submit(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Async executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
