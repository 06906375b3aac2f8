package com.existence.arbitration.cdi;

import com.existence.arbitration.api.ArbitrationOptions;
import com.existence.arbitration.api.ExistenceEngine;
import com.existence.arbitration.api.ExistenceEngineRegistry;
import com.existence.arbitration.detect.ElementSignalSource;
import com.existence.arbitration.detect.MarkSignalSource;
import com.existence.arbitration.event.NotificationSink;
import com.existence.arbitration.metrics.MetricsService;
import com.existence.arbitration.metrics.MicrometerMetricsService;
import com.existence.arbitration.metrics.NoOpMetricsService;
import com.existence.arbitration.store.InMemoryInconsistencyRepository;
import com.existence.arbitration.store.InMemoryStatusStore;
import com.existence.arbitration.store.InconsistencyRepository;
import com.existence.arbitration.store.StatusStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires existence arbitration from MicroProfile Config properties.
 *
 * <p>The host application supplies an {@link ElementSignalSource} bean and, optionally,
 * a {@link MarkSignalSource}, a {@link NotificationSink} and a Micrometer {@link MeterRegistry}.
 * Configuration keys live under {@code existence-arbitration.*}:</p>
 * <pre>
 * existence-arbitration.reconcile.auto-fix-threshold=0.90
 * existence-arbitration.binding.pending-threshold=0.80
 * existence-arbitration.notification.max-attempts=3
 * </pre>
 */
@ApplicationScoped
public class ExistenceArbitrationProducer {

    private static final Logger log = LoggerFactory.getLogger(ExistenceArbitrationProducer.class);

    // ── Thresholds ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "existence-arbitration.reconcile.auto-fix-threshold", defaultValue = "0.90")
    double autoFixThreshold;

    @Inject
    @ConfigProperty(name = "existence-arbitration.binding.pending-threshold", defaultValue = "0.80")
    double pendingThreshold;

    @Inject
    @ConfigProperty(name = "existence-arbitration.transition.strict", defaultValue = "false")
    boolean strictTransitions;

    // ── Cache and locking ─────────────────────────────────────

    @Inject
    @ConfigProperty(name = "existence-arbitration.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "existence-arbitration.lock.timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Notifications ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "existence-arbitration.notification.max-attempts", defaultValue = "3")
    int notificationMaxAttempts;

    @Inject
    @ConfigProperty(name = "existence-arbitration.notification.base-delay-millis", defaultValue = "500")
    long notificationBaseDelayMillis;

    // ── Scheduling ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "existence-arbitration.reconcile.schedule-enabled", defaultValue = "false")
    boolean scheduleEnabled;

    @Inject
    @ConfigProperty(name = "existence-arbitration.reconcile.interval-seconds", defaultValue = "300")
    long reconcileIntervalSeconds;

    @Inject
    @ConfigProperty(name = "existence-arbitration.reconcile.scheduled-auto-fix", defaultValue = "true")
    boolean scheduledAutoFix;

    @Inject
    @ConfigProperty(name = "existence-arbitration.async.timeout-millis", defaultValue = "30000")
    long asyncTimeoutMillis;

    // ── Host-provided collaborators ───────────────────────────

    @Inject
    Instance<ElementSignalSource> elementSignals;

    @Inject
    Instance<MarkSignalSource> markSignals;

    @Inject
    Instance<NotificationSink> notificationSinks;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ArbitrationOptions arbitrationOptions() {
        return ArbitrationOptions.builder()
                .autoFixThreshold(autoFixThreshold)
                .pendingProvenanceThreshold(pendingThreshold)
                .strictTransitions(strictTransitions)
                .cacheMaxSize(cacheMaxSize)
                .lockTimeout(Duration.ofMillis(lockTimeoutMillis))
                .notificationMaxAttempts(notificationMaxAttempts)
                .notificationBaseDelay(Duration.ofMillis(notificationBaseDelayMillis))
                .reconcileInterval(Duration.ofSeconds(reconcileIntervalSeconds))
                .scheduledAutoFix(scheduledAutoFix)
                .asyncTimeoutMs(asyncTimeoutMillis)
                .build();
    }

    @Produces
    @ApplicationScoped
    public StatusStore statusStore() {
        return new InMemoryStatusStore();
    }

    @Produces
    @ApplicationScoped
    public InconsistencyRepository inconsistencyRepository() {
        return new InMemoryInconsistencyRepository();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistries.isResolvable()) {
            log.info("Existence metrics published to Micrometer");
            return new MicrometerMetricsService(meterRegistries.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public ExistenceEngineRegistry existenceEngineRegistry(ArbitrationOptions options, StatusStore statusStore,
                                                           InconsistencyRepository inconsistencyRepository,
                                                           MetricsService metricsService) {
        if (!elementSignals.isResolvable()) {
            throw new IllegalStateException("An ElementSignalSource bean is required");
        }
        ElementSignalSource elements = elementSignals.get();
        MarkSignalSource marks = markSignals.isResolvable() ? markSignals.get() : null;
        NotificationSink sink = notificationSinks.isResolvable() ? notificationSinks.get() : null;
        log.info("Producing ExistenceEngineRegistry: autoFixThreshold={} strict={} marks={} notifications={}",
                options.getAutoFixThreshold(), options.isStrictTransitions(), marks != null, sink != null);

        return new ExistenceEngineRegistry(scopeId -> ExistenceEngine.builder()
                .statusStore(statusStore)
                .inconsistencyRepository(inconsistencyRepository)
                .elementSignals(elements)
                .markSignals(marks)
                .notificationSink(sink)
                .metricsService(metricsService)
                .options(options)
                .build(), scheduleEnabled);
    }

    public void closeRegistry(@Disposes ExistenceEngineRegistry registry) {
        log.info("Closing ExistenceEngineRegistry");
        registry.close();
    }
}
