package com.existence.arbitration.metrics;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.TransitionType;

/**
 * Interface for recording existence arbitration metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void incrementTransition(BindingStatus status, TransitionType cause);

    void incrementSkippedTransition(TransitionType cause);

    void incrementTransitionFailure(TransitionType cause);

    void recordReconciliation(int findings, int autoFixed, int requiresHumanReview);

    void incrementArbitration(ResolutionAction action);
}
