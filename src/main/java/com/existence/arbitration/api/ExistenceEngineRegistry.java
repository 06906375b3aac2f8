package com.existence.arbitration.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds one initialized {@link ExistenceEngine} per scope.
 * Engines are created lazily by the factory and initialized on first use.
 */
public class ExistenceEngineRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExistenceEngineRegistry.class);

    private final Function<String, ExistenceEngine> engineFactory;
    private final boolean scheduleReconciliation;
    private final Map<String, ExistenceEngine> engines = new ConcurrentHashMap<>();

    /**
     * @param engineFactory builds an uninitialized engine for a scope id
     */
    public ExistenceEngineRegistry(Function<String, ExistenceEngine> engineFactory) {
        this(engineFactory, false);
    }

    /**
     * @param scheduleReconciliation start periodic reconciliation for each engine once initialized
     */
    public ExistenceEngineRegistry(Function<String, ExistenceEngine> engineFactory,
                                   boolean scheduleReconciliation) {
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory is required");
        this.scheduleReconciliation = scheduleReconciliation;
    }

    /**
     * Gets the engine of a scope, creating and initializing it if needed.
     */
    public ExistenceEngine forScope(String scopeId) {
        Objects.requireNonNull(scopeId, "scopeId is required");
        return engines.computeIfAbsent(scopeId, id -> {
            ExistenceEngine engine = engineFactory.apply(id);
            engine.initialize(id);
            if (scheduleReconciliation) {
                engine.scheduleReconciliation();
            }
            return engine;
        });
    }

    public Optional<ExistenceEngine> find(String scopeId) {
        return Optional.ofNullable(engines.get(scopeId));
    }

    /**
     * Reloads a scope's index from the store.
     *
     * @return number of bindings indexed
     */
    public int refresh(String scopeId) {
        return forScope(scopeId).initialize(scopeId);
    }

    public Set<String> activeScopes() {
        return Set.copyOf(engines.keySet());
    }

    /**
     * Closes and forgets the engine of a scope.
     */
    public void close(String scopeId) {
        ExistenceEngine engine = engines.remove(scopeId);
        if (engine != null) {
            engine.close();
            log.info("Closed existence engine for scope {}", scopeId);
        }
    }

    @Override
    public void close() {
        for (String scopeId : Set.copyOf(engines.keySet())) {
            close(scopeId);
        }
    }
}
