package com.existence.arbitration.metrics;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.TransitionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code existence.transition} - Counter (tags: status, cause)</li>
 *   <li>{@code existence.transition.skipped} - Counter (tag: cause)</li>
 *   <li>{@code existence.transition.failed} - Counter (tag: cause)</li>
 *   <li>{@code existence.reconcile.findings} - DistributionSummary</li>
 *   <li>{@code existence.reconcile.autofixed} - Counter</li>
 *   <li>{@code existence.reconcile.review} - Counter</li>
 *   <li>{@code existence.arbitration} - Counter (tag: action)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary findingsSummary;
    private final Counter autoFixedCounter;
    private final Counter reviewCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.findingsSummary = DistributionSummary.builder("existence.reconcile.findings")
                .description("Inconsistencies found per reconciliation pass")
                .register(registry);
        this.autoFixedCounter = Counter.builder("existence.reconcile.autofixed")
                .description("Inconsistencies repaired automatically")
                .register(registry);
        this.reviewCounter = Counter.builder("existence.reconcile.review")
                .description("Inconsistencies demoted to human review")
                .register(registry);
    }

    @Override
    public void incrementTransition(BindingStatus status, TransitionType cause) {
        String key = "transition:" + status.name() + ":" + cause.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("existence.transition")
                        .description("Applied binding status transitions")
                        .tag("status", status.wireName())
                        .tag("cause", cause.wireName())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementSkippedTransition(TransitionType cause) {
        String key = "skipped:" + cause.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("existence.transition.skipped")
                        .description("Idempotent transitions that changed nothing")
                        .tag("cause", cause.wireName())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementTransitionFailure(TransitionType cause) {
        String key = "failed:" + cause.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("existence.transition.failed")
                        .description("Transitions that raised an error")
                        .tag("cause", cause.wireName())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordReconciliation(int findings, int autoFixed, int requiresHumanReview) {
        findingsSummary.record(findings);
        autoFixedCounter.increment(autoFixed);
        reviewCounter.increment(requiresHumanReview);
    }

    @Override
    public void incrementArbitration(ResolutionAction action) {
        String key = "arbitration:" + action.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("existence.arbitration")
                        .description("Human arbitration decisions")
                        .tag("action", action.wireName())
                        .register(registry))
                .increment();
    }
}
