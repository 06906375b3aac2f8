package com.existence.arbitration.api;

import com.existence.arbitration.arbitration.ArbitrationService;
import com.existence.arbitration.cache.CacheConfig;
import com.existence.arbitration.cache.CaffeineExistenceCache;
import com.existence.arbitration.cache.ExistenceCache;
import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.ExistenceCacheEntry;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.NewBinding;
import com.existence.arbitration.core.model.Provenance;
import com.existence.arbitration.core.model.StatusLogEntry;
import com.existence.arbitration.detect.ElementSignalSource;
import com.existence.arbitration.detect.InconsistencyDetector;
import com.existence.arbitration.detect.MarkSignalSource;
import com.existence.arbitration.engine.StatusUpdate;
import com.existence.arbitration.engine.TransitionEngine;
import com.existence.arbitration.engine.TransitionPolicy;
import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.event.BindingEventListener;
import com.existence.arbitration.event.CompositeEventPublisher;
import com.existence.arbitration.event.EventPublisher;
import com.existence.arbitration.event.InProcessEventBus;
import com.existence.arbitration.event.NotificationDispatcher;
import com.existence.arbitration.event.NotificationSink;
import com.existence.arbitration.index.EngineNotInitializedException;
import com.existence.arbitration.index.MemoryIndex;
import com.existence.arbitration.lock.BindingLock;
import com.existence.arbitration.lock.LocalBindingLock;
import com.existence.arbitration.metrics.MetricsService;
import com.existence.arbitration.metrics.NoOpMetricsService;
import com.existence.arbitration.reconcile.ReconcileResult;
import com.existence.arbitration.reconcile.Reconciler;
import com.existence.arbitration.reconcile.ReconciliationScheduler;
import com.existence.arbitration.store.InMemoryInconsistencyRepository;
import com.existence.arbitration.store.InMemoryStatusStore;
import com.existence.arbitration.store.InconsistencyRepository;
import com.existence.arbitration.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Main entry point for existence arbitration of one scope (canvas).
 *
 * <p>An engine owns the in-memory index of exactly one active scope. Create one per
 * scope, or let an {@link ExistenceEngineRegistry} manage them:</p>
 *
 * <pre>{@code
 * ExistenceEngine engine = ExistenceEngine.builder()
 *         .elementSignals(canvasAdapter)
 *         .markSignals(documentAdapter)
 *         .build();
 * engine.initialize("canvas-1");
 * engine.hideByElementIds(List.of("el-1"), "user-1");
 * }</pre>
 */
public class ExistenceEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExistenceEngine.class);

    private final StatusStore statusStore;
    private final InconsistencyRepository inconsistencyRepository;
    private final ExistenceCache existenceCache;
    private final MemoryIndex index;
    private final InProcessEventBus eventBus;
    private final NotificationDispatcher notificationDispatcher;
    private final TransitionEngine transitionEngine;
    private final Reconciler reconciler;
    private final ArbitrationService arbitrationService;
    private final ArbitrationOptions options;
    private final Clock clock;
    private final List<ReconciliationScheduler> schedulers = new ArrayList<>();

    private ExistenceEngine(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.statusStore = builder.statusStore != null
                ? builder.statusStore : new InMemoryStatusStore();
        this.inconsistencyRepository = builder.inconsistencyRepository != null
                ? builder.inconsistencyRepository : new InMemoryInconsistencyRepository();
        this.existenceCache = builder.existenceCache != null
                ? builder.existenceCache
                : new CaffeineExistenceCache(new CacheConfig(options.getCacheMaxSize()), clock);
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        BindingLock bindingLock = builder.bindingLock != null
                ? builder.bindingLock : new LocalBindingLock(options.getLockTimeout());
        TransitionPolicy policy = builder.transitionPolicy != null
                ? builder.transitionPolicy
                : options.isStrictTransitions() ? TransitionPolicy.strict() : TransitionPolicy.permissive();

        // Listeners run first, then external publishers, then the notification channel
        this.eventBus = new InProcessEventBus();
        List<EventPublisher> publishers = new ArrayList<>();
        publishers.add(eventBus);
        publishers.addAll(builder.eventPublishers);
        if (builder.notificationSink != null) {
            this.notificationDispatcher = new NotificationDispatcher(builder.notificationSink,
                    options.getNotificationMaxAttempts(), options.getNotificationBaseDelay());
            publishers.add(notificationDispatcher);
        } else {
            this.notificationDispatcher = null;
        }
        EventPublisher eventPublisher = new CompositeEventPublisher(publishers);

        this.index = new MemoryIndex(statusStore, existenceCache);
        this.transitionEngine = new TransitionEngine(statusStore, index, existenceCache,
                eventPublisher, bindingLock, policy, metricsService, clock);
        InconsistencyDetector detector = new InconsistencyDetector(statusStore,
                builder.elementSignals, builder.markSignals, clock);
        this.reconciler = new Reconciler(detector, inconsistencyRepository, transitionEngine,
                metricsService, options.getAutoFixThreshold(), clock);
        this.arbitrationService = new ArbitrationService(transitionEngine, index,
                inconsistencyRepository, eventPublisher, metricsService, clock);
    }

    // ========== Lifecycle ==========

    /**
     * Loads every binding of the scope into the in-memory index, replacing any previous scope.
     * Calling it again for the same scope refreshes the index from the store.
     *
     * @return number of bindings indexed
     */
    public int initialize(String scopeId) {
        Objects.requireNonNull(scopeId, "scopeId is required");
        int loaded = index.initialize(scopeId);
        log.info("Existence engine initialized for scope {} with {} bindings", scopeId, loaded);
        return loaded;
    }

    public boolean isInitialized() {
        return index.isInitialized();
    }

    /**
     * Establishes a new binding in the store and, when it belongs to the active scope, in the index.
     * Links created by AI or the system below the pending-provenance threshold start out pending.
     */
    public Binding registerBinding(NewBinding request) {
        Objects.requireNonNull(request, "request is required");
        BindingStatus initial = request.provenance() != Provenance.USER
                && request.provenanceConfidence() < options.getPendingProvenanceThreshold()
                ? BindingStatus.PENDING : BindingStatus.VISIBLE;
        Binding binding = Binding.builder()
                .id(UUID.randomUUID().toString())
                .containerId(request.containerId())
                .documentId(request.documentId())
                .linkedElementId(request.linkedElementId())
                .linkedBlockId(request.linkedBlockId())
                .linkedMarkId(request.linkedMarkId())
                .currentStatus(initial)
                .statusUpdatedAt(clock.instant())
                .provenance(request.provenance())
                .provenanceConfidence(request.provenanceConfidence())
                .version(0)
                .createdAt(clock.instant())
                .build();
        Binding stored = statusStore.insert(binding);
        boolean indexed = index.isInitialized() && index.register(stored);
        log.debug("binding.registered id={} element={} status={} indexed={}",
                stored.getId(), stored.getLinkedElementId(), initial.wireName(), indexed);
        return stored;
    }

    /**
     * Creates a scheduler that reconciles the active scope at the configured interval.
     * The scheduler is started, and stopped when this engine is closed.
     */
    public synchronized ReconciliationScheduler scheduleReconciliation() {
        ReconciliationScheduler scheduler = new ReconciliationScheduler(reconciler, requireScope(),
                options.isScheduledAutoFix(), options.getReconcileInterval());
        scheduler.start();
        schedulers.add(scheduler);
        return scheduler;
    }

    // ========== Mutations ==========

    public TransitionResult hide(String bindingId, String actorId) {
        return transitionEngine.hide(bindingId, actorId);
    }

    public TransitionResult show(String bindingId, String actorId) {
        return transitionEngine.show(bindingId, actorId);
    }

    public TransitionResult softDelete(String bindingId, String actorId) {
        return transitionEngine.softDelete(bindingId, actorId);
    }

    public TransitionResult restore(String bindingId, String actorId) {
        return transitionEngine.restore(bindingId, actorId);
    }

    public int hideMany(List<String> bindingIds, String actorId) {
        return transitionEngine.hideMany(bindingIds, actorId);
    }

    public int showMany(List<String> bindingIds, String actorId) {
        return transitionEngine.showMany(bindingIds, actorId);
    }

    /**
     * Hides the bindings of elements deleted in the canvas. Unmapped element ids are ignored.
     */
    public int hideByElementIds(List<String> elementIds, String actorId) {
        return transitionEngine.hideByElementIds(elementIds, actorId);
    }

    public int showByElementIds(List<String> elementIds, String actorId) {
        return transitionEngine.showByElementIds(elementIds, actorId);
    }

    public int applyStatusUpdates(List<StatusUpdate> updates, String actorId) {
        return transitionEngine.applyStatusUpdates(updates, actorId);
    }

    // ========== Queries ==========

    public Optional<BindingStatus> getStatus(String bindingId) {
        return index.getStatus(bindingId);
    }

    public List<String> getBindingsByStatus(BindingStatus status) {
        return index.listByStatus(status);
    }

    public Optional<String> getBindingByElementId(String elementId) {
        return index.findByElementId(elementId);
    }

    public Set<String> getBindingsByBlockId(String blockId) {
        return index.findByBlockId(blockId);
    }

    public Optional<Binding> getBinding(String bindingId) {
        return statusStore.findById(bindingId);
    }

    public Optional<ExistenceCacheEntry> getExistence(String bindingId) {
        return existenceCache.get(bindingId);
    }

    /**
     * Gets the status log of a binding, oldest first.
     */
    public List<StatusLogEntry> getStatusHistory(String bindingId) {
        return statusStore.findLogByBindingId(bindingId);
    }

    public EngineStatus getEngineStatus() {
        if (!index.isInitialized()) {
            return new EngineStatus(false, null, 0, 0, 0,
                    existenceCache.getStats().size(), inconsistencyRepository.countOpen());
        }
        return new EngineStatus(true, index.getScopeId(), index.size(),
                index.elementIndexSize(), index.blockIndexSize(),
                existenceCache.getStats().size(), inconsistencyRepository.countOpen());
    }

    // ========== Reconciliation and arbitration ==========

    /**
     * Reconciles the active scope.
     *
     * @throws IllegalArgumentException if {@code scopeId} is not the scope this engine serves
     */
    public ReconcileResult reconcile(String scopeId, boolean autoFix) {
        String active = requireScope();
        if (!active.equals(scopeId)) {
            throw new IllegalArgumentException("Engine serves scope " + active + ", not " + scopeId);
        }
        return reconciler.reconcile(scopeId, autoFix);
    }

    public ReconcileResult reconcile(boolean autoFix) {
        return reconciler.reconcile(requireScope(), autoFix);
    }

    public TransitionResult approve(String bindingId, String userId) {
        return arbitrationService.approve(bindingId, userId);
    }

    public TransitionResult reject(String bindingId, String userId, String reason) {
        return arbitrationService.reject(bindingId, userId, reason);
    }

    public Page<Inconsistency> getPendingReviews(PageRequest page) {
        return arbitrationService.getPendingReviews(page);
    }

    public List<Inconsistency> getOpenInconsistencies(String bindingId) {
        return arbitrationService.getOpenInconsistencies(bindingId);
    }

    // ========== Events ==========

    public void subscribe(BindingEventListener listener) {
        eventBus.subscribe(listener);
    }

    public void unsubscribe(BindingEventListener listener) {
        eventBus.unsubscribe(listener);
    }

    // ========== Accessors ==========

    public ArbitrationService getArbitrationService() {
        return arbitrationService;
    }

    public TransitionEngine getTransitionEngine() {
        return transitionEngine;
    }

    public ArbitrationOptions getOptions() {
        return options;
    }

    /**
     * Creates an {@link AsyncExistenceEngine} wrapping this engine.
     */
    public AsyncExistenceEngine async() {
        return new AsyncExistenceEngine(this, options.getAsyncTimeoutMs());
    }

    private String requireScope() {
        if (!index.isInitialized()) {
            throw new EngineNotInitializedException();
        }
        return index.getScopeId();
    }

    @Override
    public synchronized void close() {
        for (ReconciliationScheduler scheduler : schedulers) {
            scheduler.close();
        }
        schedulers.clear();
        if (notificationDispatcher != null) {
            notificationDispatcher.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StatusStore statusStore;
        private InconsistencyRepository inconsistencyRepository;
        private ExistenceCache existenceCache;
        private ElementSignalSource elementSignals;
        private MarkSignalSource markSignals;
        private NotificationSink notificationSink;
        private final List<EventPublisher> eventPublishers = new ArrayList<>();
        private BindingLock bindingLock;
        private TransitionPolicy transitionPolicy;
        private MetricsService metricsService;
        private ArbitrationOptions options = ArbitrationOptions.defaults();
        private Clock clock = Clock.systemUTC();

        /**
         * Sets the binding store. Engines of different scopes may share one store.
         */
        public Builder statusStore(StatusStore statusStore) {
            this.statusStore = statusStore;
            return this;
        }

        public Builder inconsistencyRepository(InconsistencyRepository repository) {
            this.inconsistencyRepository = repository;
            return this;
        }

        public Builder existenceCache(ExistenceCache existenceCache) {
            this.existenceCache = existenceCache;
            return this;
        }

        /**
         * Sets the canvas-side signal source. Required.
         */
        public Builder elementSignals(ElementSignalSource elementSignals) {
            this.elementSignals = elementSignals;
            return this;
        }

        /**
         * Sets the document-side signal source. Without one, mark rules are not evaluated.
         */
        public Builder markSignals(MarkSignalSource markSignals) {
            this.markSignals = markSignals;
            return this;
        }

        /**
         * Sets the channel for asynchronous, retried event notifications.
         */
        public Builder notificationSink(NotificationSink sink) {
            this.notificationSink = sink;
            return this;
        }

        public Builder eventPublisher(EventPublisher publisher) {
            this.eventPublishers.add(Objects.requireNonNull(publisher, "publisher is required"));
            return this;
        }

        public Builder bindingLock(BindingLock bindingLock) {
            this.bindingLock = bindingLock;
            return this;
        }

        /**
         * Overrides the policy derived from {@link ArbitrationOptions#isStrictTransitions()}.
         */
        public Builder transitionPolicy(TransitionPolicy policy) {
            this.transitionPolicy = policy;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(ArbitrationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public ExistenceEngine build() {
            if (elementSignals == null) {
                throw new IllegalStateException("ElementSignalSource is required");
            }
            return new ExistenceEngine(this);
        }
    }
}
