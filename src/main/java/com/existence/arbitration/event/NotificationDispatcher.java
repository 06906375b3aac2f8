package com.existence.arbitration.event;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort asynchronous delivery of binding events to an external {@link NotificationSink}.
 *
 * <p>Each event is expanded into its signals (see {@link BindingEvent#signals()}).
 * Every signal is attempted up to {@code maxAttempts} times with exponential backoff
 * ({@code baseDelay * 2^(attempt-1)}); a signal that still fails is logged and dropped.
 * Signals already accepted for an event id are not delivered twice.</p>
 *
 * <p>Lost notifications are tolerated: reconciliation repairs whatever a projection missed.</p>
 */
public class NotificationDispatcher implements EventPublisher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    private final NotificationSink sink;
    private final int maxAttempts;
    private final long baseDelayMs;
    private final ScheduledExecutorService scheduler;
    private final Cache<String, Boolean> accepted;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public NotificationDispatcher(NotificationSink sink) {
        this(sink, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    public NotificationDispatcher(NotificationSink sink, int maxAttempts, Duration baseDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.sink = sink;
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelay.toMillis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "existence-notifications");
            t.setDaemon(true);
            return t;
        });
        this.accepted = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(Duration.ofMinutes(10))
                .build();
    }

    @Override
    public void publish(BindingEvent event) {
        String payload = EventJson.toJson(event);
        for (BindingEventType signal : event.signals()) {
            String key = event.eventId() + "|" + signal.signalName();
            if (accepted.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
                log.debug("Skipping duplicate signal {} for event {}", signal.signalName(), event.eventId());
                continue;
            }
            schedule(new Delivery(signal.signalName(), payload, event.bindingId()), 1, 0);
        }
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private void schedule(Delivery delivery, int attempt, long delayMs) {
        try {
            scheduler.schedule(() -> attempt(delivery, attempt), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            log.warn("notification.dropped signal={} bindingId={} reason=dispatcher-closed",
                    delivery.signal(), delivery.bindingId());
        }
    }

    private void attempt(Delivery delivery, int attempt) {
        try {
            sink.deliver(delivery.signal(), delivery.payload());
            delivered.incrementAndGet();
        } catch (Exception e) {
            if (attempt >= maxAttempts) {
                dropped.incrementAndGet();
                log.warn("notification.dropped signal={} bindingId={} attempts={} error={}",
                        delivery.signal(), delivery.bindingId(), attempt, e.getMessage());
                return;
            }
            long delay = baseDelayMs * (1L << (attempt - 1));
            log.debug("Notification {} for binding {} failed (attempt {}), retrying in {}ms",
                    delivery.signal(), delivery.bindingId(), attempt, delay);
            schedule(delivery, attempt + 1, delay);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Delivery(String signal, String payload, String bindingId) {}
}
