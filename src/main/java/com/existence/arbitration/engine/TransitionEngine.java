package com.existence.arbitration.engine;

import com.existence.arbitration.cache.ExistenceCache;
import com.existence.arbitration.core.BindingNotFoundException;
import com.existence.arbitration.core.model.ActorType;
import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.StatusLogEntry;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.event.BindingEvent;
import com.existence.arbitration.event.EventPublisher;
import com.existence.arbitration.index.IndexedBinding;
import com.existence.arbitration.index.MemoryIndex;
import com.existence.arbitration.lock.BindingLock;
import com.existence.arbitration.logging.LogContext;
import com.existence.arbitration.metrics.MetricsService;
import com.existence.arbitration.store.StaleBindingVersionException;
import com.existence.arbitration.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * State machine over binding statuses.
 *
 * <p>An applied transition performs, in order: a compare-and-swap status write on the
 * binding, one status log append, a cache upsert, an index update and one event
 * publication. Requesting the status a binding already has is a successful no-op
 * with no writes and no event.</p>
 *
 * <p>Transitions on the same binding are serialized by the {@link BindingLock}; writers
 * outside this engine are detected through the binding version and lose with
 * {@link StaleBindingVersionException}. Nothing is retried here: callers re-invoke,
 * which is safe because transitions are idempotent.</p>
 */
public class TransitionEngine {
    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    static final String LOG_SOURCE = "existence-engine";

    private final StatusStore statusStore;
    private final MemoryIndex index;
    private final ExistenceCache existenceCache;
    private final EventPublisher eventPublisher;
    private final BindingLock bindingLock;
    private final TransitionPolicy policy;
    private final MetricsService metricsService;
    private final Clock clock;

    public TransitionEngine(StatusStore statusStore, MemoryIndex index, ExistenceCache existenceCache,
                            EventPublisher eventPublisher, BindingLock bindingLock,
                            TransitionPolicy policy, MetricsService metricsService, Clock clock) {
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore is required");
        this.index = Objects.requireNonNull(index, "index is required");
        this.existenceCache = Objects.requireNonNull(existenceCache, "existenceCache is required");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher is required");
        this.bindingLock = Objects.requireNonNull(bindingLock, "bindingLock is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Moves a binding to a new status.
     *
     * @param actorId   who requested the change, may be null for system actions
     * @param actorType kind of actor, defaults to {@link ActorType#USER}
     * @param reason    free-text reason recorded in the status log
     * @return the outcome; {@code applied == false} when the binding already had {@code newStatus}
     * @throws BindingNotFoundException     if the binding is neither indexed nor stored for the active scope
     * @throws IllegalTransitionException   if the configured policy forbids the change
     * @throws StaleBindingVersionException if another writer changed the binding first
     */
    public TransitionResult transition(String bindingId, BindingStatus newStatus, TransitionType cause,
                                       String actorId, ActorType actorType, String reason) {
        Objects.requireNonNull(newStatus, "newStatus is required");
        Objects.requireNonNull(cause, "cause is required");
        if (index.get(bindingId).isEmpty() && !adopt(bindingId)) {
            throw new BindingNotFoundException(bindingId);
        }

        try (LogContext ignored = LogContext.forTransition(bindingId, cause.wireName())) {
            bindingLock.lock(bindingId);
            try {
                IndexedBinding current = index.get(bindingId)
                        .orElseThrow(() -> new BindingNotFoundException(bindingId));
                BindingStatus previousStatus = current.status();

                if (previousStatus == newStatus) {
                    log.debug("Binding {} already {}, skipping", bindingId, newStatus.wireName());
                    metricsService.incrementSkippedTransition(cause);
                    return TransitionResult.skipped(bindingId, newStatus);
                }

                policy.check(previousStatus, newStatus, cause);
                return apply(current, newStatus, cause, actorId,
                        actorType != null ? actorType : ActorType.USER, reason);
            } catch (RuntimeException e) {
                metricsService.incrementTransitionFailure(cause);
                throw e;
            } finally {
                bindingLock.unlock(bindingId);
            }
        }
    }

    /**
     * Indexes a binding of the active scope that another writer sharing the store
     * created after {@link MemoryIndex#initialize(String)}.
     *
     * @return true if the binding is now indexed
     */
    private boolean adopt(String bindingId) {
        Optional<Binding> stored = statusStore.findById(bindingId)
                .filter(binding -> binding.getContainerId().equals(index.getScopeId()))
                .filter(binding -> binding.getLinkedElementId() != null);
        if (stored.isEmpty()) {
            return false;
        }
        index.refresh(stored.get());
        existenceCache.upsert(bindingId, stored.get().getCurrentStatus());
        log.info("binding.adopted bindingId={} status={}", bindingId, stored.get().getCurrentStatus().wireName());
        return true;
    }

    private TransitionResult apply(IndexedBinding current, BindingStatus newStatus, TransitionType cause,
                                   String actorId, ActorType actorType, String reason) {
        String bindingId = current.bindingId();
        BindingStatus previousStatus = current.status();
        Instant now = clock.instant();

        Binding stored;
        try {
            stored = statusStore.compareAndSetStatus(bindingId, current.version(), newStatus, actorId, now);
        } catch (StaleBindingVersionException e) {
            statusStore.findById(bindingId).ifPresent(index::refresh);
            log.warn("binding.transition.stale bindingId={} expectedVersion={} actualVersion={}",
                    bindingId, e.getExpectedVersion(), e.getActualVersion());
            throw e;
        }

        statusStore.append(StatusLogEntry.builder()
                .bindingId(bindingId)
                .status(newStatus)
                .previousStatus(previousStatus)
                .transitionType(cause)
                .reason(reason)
                .actorId(actorId)
                .actorType(actorType)
                .timestamp(now)
                .metadata(Map.of(
                        "source", LOG_SOURCE,
                        "version", stored.getVersion(),
                        "scopeId", current.containerId()))
                .build());

        existenceCache.upsert(bindingId, newStatus);
        index.update(bindingId, newStatus, stored.getVersion());

        eventPublisher.publish(BindingEvent.statusChanged(current.containerId(), bindingId, current.elementId(),
                newStatus, previousStatus, actorId, reason, now));

        metricsService.incrementTransition(newStatus, cause);
        log.info("binding.transition bindingId={} from={} to={} cause={} actorId={}",
                bindingId, previousStatus.wireName(), newStatus.wireName(), cause.wireName(), actorId);
        return new TransitionResult(bindingId, previousStatus, newStatus, true);
    }

    public TransitionResult hide(String bindingId, String actorId) {
        return transition(bindingId, BindingStatus.HIDDEN, TransitionType.USER_HIDE,
                actorId, ActorType.USER, "User hid binding");
    }

    public TransitionResult show(String bindingId, String actorId) {
        return transition(bindingId, BindingStatus.VISIBLE, TransitionType.USER_SHOW,
                actorId, ActorType.USER, "User showed binding");
    }

    public TransitionResult softDelete(String bindingId, String actorId) {
        return transition(bindingId, BindingStatus.DELETED, TransitionType.USER_DELETE,
                actorId, ActorType.USER, "User deleted binding");
    }

    public TransitionResult restore(String bindingId, String actorId) {
        return transition(bindingId, BindingStatus.VISIBLE, TransitionType.USER_RESTORE,
                actorId, ActorType.USER, "User restored binding");
    }

    /**
     * Hides each binding in turn. Failures are logged and skipped.
     *
     * @return number of bindings for which the transition succeeded, idempotent skips included
     */
    public int hideMany(List<String> bindingIds, String actorId) {
        return forEach("hideMany", bindingIds, id -> hide(id, actorId));
    }

    public int showMany(List<String> bindingIds, String actorId) {
        return forEach("showMany", bindingIds, id -> show(id, actorId));
    }

    /**
     * Hides the bindings linked to the given canvas elements. Elements without a
     * binding are ignored and not counted.
     */
    public int hideByElementIds(List<String> elementIds, String actorId) {
        return forEach("hideByElementIds", resolveElements(elementIds), id -> hide(id, actorId));
    }

    public int showByElementIds(List<String> elementIds, String actorId) {
        return forEach("showByElementIds", resolveElements(elementIds), id -> show(id, actorId));
    }

    /**
     * Applies explicit per-binding statuses sequentially. {@code pending} is reserved for
     * reconciliation and such items are rejected individually.
     *
     * @return number of items applied or already in the requested status
     */
    public int applyStatusUpdates(List<StatusUpdate> updates, String actorId) {
        int succeeded = 0;
        for (StatusUpdate update : updates) {
            try {
                transition(update.bindingId(), update.status(), causeFor(update.status()),
                        actorId, ActorType.USER, "Batch status update");
                succeeded++;
            } catch (RuntimeException e) {
                log.warn("batch.item.failed operation=applyStatusUpdates bindingId={} error={}",
                        update.bindingId(), e.getMessage());
            }
        }
        log.debug("applyStatusUpdates completed {}/{}", succeeded, updates.size());
        return succeeded;
    }

    private static TransitionType causeFor(BindingStatus status) {
        switch (status) {
            case VISIBLE:
                return TransitionType.USER_SHOW;
            case HIDDEN:
                return TransitionType.USER_HIDE;
            case DELETED:
                return TransitionType.USER_DELETE;
            default:
                throw new IllegalArgumentException("Status " + status.wireName() + " cannot be set directly");
        }
    }

    private List<String> resolveElements(List<String> elementIds) {
        return elementIds.stream()
                .filter(elementId -> {
                    if (elementId == null) {
                        log.warn("batch.item.skipped reason=null-element-id");
                        return false;
                    }
                    return true;
                })
                .map(index::findByElementId)
                .flatMap(Optional::stream)
                .toList();
    }

    private int forEach(String operation, List<String> bindingIds, Function<String, TransitionResult> action) {
        int succeeded = 0;
        for (String bindingId : bindingIds) {
            try {
                action.apply(bindingId);
                succeeded++;
            } catch (RuntimeException e) {
                log.warn("batch.item.failed operation={} bindingId={} error={}",
                        operation, bindingId, e.getMessage());
            }
        }
        log.debug("{} completed {}/{}", operation, succeeded, bindingIds.size());
        return succeeded;
    }
}
