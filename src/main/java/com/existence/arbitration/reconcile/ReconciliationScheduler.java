package com.existence.arbitration.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link Reconciler#reconcile(String, boolean)} for one scope at a fixed delay.
 * A failing pass is logged and the schedule continues.
 */
public class ReconciliationScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final Reconciler reconciler;
    private final String scopeId;
    private final boolean autoFix;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private final AtomicReference<ReconcileResult> lastResult = new AtomicReference<>();
    private ScheduledFuture<?> task;

    public ReconciliationScheduler(Reconciler reconciler, String scopeId, boolean autoFix, Duration interval) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler is required");
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId is required");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.autoFix = autoFix;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "existence-reconcile-" + scopeId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = executor.scheduleWithFixedDelay(this::runOnce, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("reconcile.schedule.started scopeId={} interval={} autoFix={}", scopeId, interval, autoFix);
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    /**
     * Executes one pass on the calling thread.
     */
    void runOnce() {
        try {
            lastResult.set(reconciler.reconcile(scopeId, autoFix));
        } catch (Exception e) {
            log.error("reconcile.schedule.failed scopeId={} error={}", scopeId, e.getMessage(), e);
        }
    }

    /**
     * Gets the result of the most recent successful pass, or null if none completed yet.
     */
    public ReconcileResult getLastResult() {
        return lastResult.get();
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("reconcile.schedule.stopped scopeId={}", scopeId);
        }
    }

    @Override
    public void close() {
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
