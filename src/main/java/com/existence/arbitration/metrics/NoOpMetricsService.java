package com.existence.arbitration.metrics;

import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.TransitionType;

/**
 * No-op metrics implementation. Used by default when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementTransition(BindingStatus status, TransitionType cause) {
    }

    @Override
    public void incrementSkippedTransition(TransitionType cause) {
    }

    @Override
    public void incrementTransitionFailure(TransitionType cause) {
    }

    @Override
    public void recordReconciliation(int findings, int autoFixed, int requiresHumanReview) {
    }

    @Override
    public void incrementArbitration(ResolutionAction action) {
    }
}
