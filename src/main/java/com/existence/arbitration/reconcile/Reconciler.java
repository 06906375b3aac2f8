package com.existence.arbitration.reconcile;

import com.existence.arbitration.core.model.ActorType;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.detect.InconsistencyDetector;
import com.existence.arbitration.engine.TransitionEngine;
import com.existence.arbitration.logging.LogContext;
import com.existence.arbitration.metrics.MetricsService;
import com.existence.arbitration.store.InconsistencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs detection over a scope, records every finding, repairs high-confidence
 * findings and demotes the rest to {@code pending} for human arbitration.
 *
 * <p>A pass never aborts on a single binding: a failed auto-fix is counted as
 * requiring review. Passes may run concurrently with live transitions and be
 * repeated at will; a repaired binding no longer diverges, and bindings already
 * pending or deleted are not re-reported.</p>
 */
public class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    public static final String SYSTEM_ACTOR = "system";
    public static final double DEFAULT_AUTO_FIX_THRESHOLD = 0.90;

    private final InconsistencyDetector detector;
    private final InconsistencyRepository inconsistencyRepository;
    private final TransitionEngine transitionEngine;
    private final MetricsService metricsService;
    private final double autoFixThreshold;
    private final Clock clock;

    public Reconciler(InconsistencyDetector detector, InconsistencyRepository inconsistencyRepository,
                      TransitionEngine transitionEngine, MetricsService metricsService,
                      double autoFixThreshold, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.inconsistencyRepository = Objects.requireNonNull(inconsistencyRepository,
                "inconsistencyRepository is required");
        this.transitionEngine = Objects.requireNonNull(transitionEngine, "transitionEngine is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        if (autoFixThreshold < 0.0 || autoFixThreshold > 1.0) {
            throw new IllegalArgumentException("autoFixThreshold must be in [0, 1]");
        }
        this.autoFixThreshold = autoFixThreshold;
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Reconciles a scope.
     *
     * @param autoFix whether findings at or above the auto-fix threshold are repaired;
     *                when false every finding is demoted to pending
     * @throws com.existence.arbitration.detect.SignalUnavailableException if projection signals cannot be read
     */
    public ReconcileResult reconcile(String scopeId, boolean autoFix) {
        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forReconciliation(scopeId, runId)) {
            log.info("reconcile.started scopeId={} autoFix={}", scopeId, autoFix);
            List<Inconsistency> findings = detector.detect(scopeId);

            int autoFixed = 0;
            int requiresHumanReview = 0;
            List<Inconsistency> recorded = new ArrayList<>(findings.size());

            for (Inconsistency finding : findings) {
                Inconsistency saved = openFindingLike(finding)
                        .orElseGet(() -> inconsistencyRepository.save(finding));

                if (autoFix && finding.getResolutionConfidence() >= autoFixThreshold) {
                    Inconsistency fixed = autoFix(saved);
                    if (fixed != null) {
                        autoFixed++;
                        recorded.add(fixed);
                    } else {
                        requiresHumanReview++;
                        recorded.add(saved);
                    }
                } else {
                    demote(saved);
                    requiresHumanReview++;
                    recorded.add(saved);
                }
            }

            metricsService.recordReconciliation(findings.size(), autoFixed, requiresHumanReview);
            log.info("reconcile.completed scopeId={} total={} autoFixed={} requiresHumanReview={}",
                    scopeId, findings.size(), autoFixed, requiresHumanReview);
            return new ReconcileResult(scopeId, autoFixed, requiresHumanReview, recorded);
        }
    }

    /**
     * Gets the unresolved finding of the same type for the binding, so a rerun does not
     * record the same divergence twice.
     */
    private Optional<Inconsistency> openFindingLike(Inconsistency finding) {
        return inconsistencyRepository.findOpenByBindingId(finding.getBindingId()).stream()
                .filter(open -> open.getType() == finding.getType())
                .findFirst();
    }

    /**
     * @return the resolved finding, or null if the repair failed
     */
    private Inconsistency autoFix(Inconsistency finding) {
        BindingStatus target = finding.getSuggestedResolution().targetStatus();
        try {
            transitionEngine.transition(finding.getBindingId(), target, TransitionType.SYSTEM_RECONCILE,
                    null, ActorType.SYSTEM, "Auto-fix: " + finding.getType().wireName());
            return inconsistencyRepository.resolve(finding.getId(), ResolutionAction.AUTO_FIXED, SYSTEM_ACTOR,
                    finding.getSuggestedResolution().label(), clock.instant());
        } catch (RuntimeException e) {
            log.warn("reconcile.autofix.failed bindingId={} type={} error={}",
                    finding.getBindingId(), finding.getType().wireName(), e.getMessage());
            return null;
        }
    }

    private void demote(Inconsistency finding) {
        try {
            transitionEngine.transition(finding.getBindingId(), BindingStatus.PENDING,
                    TransitionType.SYSTEM_RECONCILE, null, ActorType.SYSTEM,
                    "Low confidence, requires human review");
        } catch (RuntimeException e) {
            log.warn("reconcile.demote.failed bindingId={} type={} error={}",
                    finding.getBindingId(), finding.getType().wireName(), e.getMessage());
        }
    }

    public double getAutoFixThreshold() {
        return autoFixThreshold;
    }
}
