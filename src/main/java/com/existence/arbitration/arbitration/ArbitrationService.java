package com.existence.arbitration.arbitration;

import com.existence.arbitration.api.Page;
import com.existence.arbitration.api.PageRequest;
import com.existence.arbitration.core.BindingNotFoundException;
import com.existence.arbitration.core.model.ActorType;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.engine.TransitionEngine;
import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.event.BindingEvent;
import com.existence.arbitration.event.BindingEventType;
import com.existence.arbitration.event.EventPublisher;
import com.existence.arbitration.index.IndexedBinding;
import com.existence.arbitration.index.MemoryIndex;
import com.existence.arbitration.logging.LogContext;
import com.existence.arbitration.metrics.MetricsService;
import com.existence.arbitration.store.InconsistencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Human-in-the-loop resolution of bindings demoted to {@code pending}.
 *
 * <p>Approving makes the binding visible again; rejecting tombstones it. Either way the
 * most recent open inconsistency of the binding is closed with the decision.
 * The caller is responsible for checking that {@code userId} is the authenticated user.</p>
 */
public class ArbitrationService {
    private static final Logger log = LoggerFactory.getLogger(ArbitrationService.class);

    static final String APPROVAL_NOTES = "Binding approved by human arbitration";

    private final TransitionEngine transitionEngine;
    private final MemoryIndex index;
    private final InconsistencyRepository inconsistencyRepository;
    private final EventPublisher eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;

    public ArbitrationService(TransitionEngine transitionEngine, MemoryIndex index,
                              InconsistencyRepository inconsistencyRepository, EventPublisher eventPublisher,
                              MetricsService metricsService, Clock clock) {
        this.transitionEngine = Objects.requireNonNull(transitionEngine, "transitionEngine is required");
        this.index = Objects.requireNonNull(index, "index is required");
        this.inconsistencyRepository = Objects.requireNonNull(inconsistencyRepository,
                "inconsistencyRepository is required");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Approves a binding: it becomes visible and its open finding is closed as approved.
     *
     * @throws BindingNotFoundException if the binding is not indexed
     */
    public TransitionResult approve(String bindingId, String userId) {
        requireUser(userId);
        try (LogContext ignored = LogContext.forArbitration(bindingId, userId)) {
            IndexedBinding binding = requireIndexed(bindingId);
            TransitionResult result = transitionEngine.transition(bindingId, BindingStatus.VISIBLE,
                    TransitionType.ARBITRATION_APPROVE, userId, ActorType.USER, "Human approved binding");

            Instant now = clock.instant();
            closeLatestFinding(bindingId, ResolutionAction.APPROVED, userId, APPROVAL_NOTES, now);
            eventPublisher.publish(BindingEvent.arbitrated(BindingEventType.APPROVED, binding.containerId(),
                    bindingId, binding.elementId(), BindingStatus.VISIBLE, userId, null, now));
            metricsService.incrementArbitration(ResolutionAction.APPROVED);

            log.info("arbitration.approved bindingId={} userId={}", bindingId, userId);
            return result;
        }
    }

    /**
     * Rejects a binding: it is tombstoned and its open finding is closed as rejected
     * with the reason as notes.
     *
     * @throws BindingNotFoundException if the binding is not indexed
     */
    public TransitionResult reject(String bindingId, String userId, String reason) {
        requireUser(userId);
        try (LogContext ignored = LogContext.forArbitration(bindingId, userId)) {
            IndexedBinding binding = requireIndexed(bindingId);
            TransitionResult result = transitionEngine.transition(bindingId, BindingStatus.DELETED,
                    TransitionType.ARBITRATION_REJECT, userId, ActorType.USER,
                    "Human rejected binding: " + reason);

            Instant now = clock.instant();
            closeLatestFinding(bindingId, ResolutionAction.REJECTED, userId, reason, now);
            eventPublisher.publish(BindingEvent.arbitrated(BindingEventType.REJECTED, binding.containerId(),
                    bindingId, binding.elementId(), BindingStatus.DELETED, userId, reason, now));
            metricsService.incrementArbitration(ResolutionAction.REJECTED);

            log.info("arbitration.rejected bindingId={} userId={} reason={}", bindingId, userId, reason);
            return result;
        }
    }

    /**
     * Gets open findings whose binding currently awaits arbitration, oldest first.
     */
    public Page<Inconsistency> getPendingReviews(PageRequest page) {
        List<Inconsistency> pending = inconsistencyRepository.findAllOpen().stream()
                .filter(i -> index.getStatus(i.getBindingId()).orElse(null) == BindingStatus.PENDING)
                .toList();
        return Page.of(pending, page);
    }

    public List<Inconsistency> getOpenInconsistencies(String bindingId) {
        return inconsistencyRepository.findOpenByBindingId(bindingId);
    }

    private void closeLatestFinding(String bindingId, ResolutionAction action, String userId,
                                    String notes, Instant at) {
        Optional<Inconsistency> open = inconsistencyRepository.findLatestOpen(bindingId);
        if (open.isEmpty()) {
            log.debug("No open inconsistency to close for binding {}", bindingId);
            return;
        }
        inconsistencyRepository.resolve(open.get().getId(), action, userId, notes, at);
    }

    private IndexedBinding requireIndexed(String bindingId) {
        return index.get(bindingId).orElseThrow(() -> new BindingNotFoundException(bindingId));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
