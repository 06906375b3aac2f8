package com.existence.arbitration.index;

import com.existence.arbitration.cache.ExistenceCache;
import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process lookup structures for the bindings of one scope (canvas).
 *
 * <p>Three maps are kept: binding by id, binding id by linked element id, and
 * binding ids by linked block id. All lookups are O(1) except
 * {@link #listByStatus(BindingStatus)}, which scans.</p>
 *
 * <p>{@link #initialize(String)} must complete before any lookup is accepted.
 * Re-initializing swaps in freshly loaded maps in one step, so readers never
 * observe a half-built index.</p>
 */
public class MemoryIndex {
    private static final Logger log = LoggerFactory.getLogger(MemoryIndex.class);

    private final StatusStore statusStore;
    private final ExistenceCache existenceCache;

    private volatile Maps maps;

    public MemoryIndex(StatusStore statusStore, ExistenceCache existenceCache) {
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore is required");
        this.existenceCache = Objects.requireNonNull(existenceCache, "existenceCache is required");
    }

    /**
     * Loads all bindings of the scope and primes the existence cache with their
     * stored status. Cache entries of bindings no longer indexed stay stale.
     * Safe to call again to refresh.
     *
     * @return the number of bindings indexed
     */
    public int initialize(String scopeId) {
        Objects.requireNonNull(scopeId, "scopeId is required");
        Maps fresh = new Maps(scopeId);
        List<Binding> bindings = statusStore.findByContainerId(scopeId);
        int skipped = 0;
        for (Binding binding : bindings) {
            if (binding.getLinkedElementId() == null) {
                skipped++;
                continue;
            }
            fresh.put(IndexedBinding.of(binding));
        }
        existenceCache.markAllStale();
        fresh.byId.values().forEach(entry -> existenceCache.upsert(entry.bindingId(), entry.status()));
        this.maps = fresh;
        log.info("index.initialized scopeId={} bindings={} skipped={}", scopeId, fresh.byId.size(), skipped);
        return fresh.byId.size();
    }

    public boolean isInitialized() {
        return maps != null;
    }

    /**
     * Gets the scope this index was loaded for, or null before initialization.
     */
    public String getScopeId() {
        Maps current = maps;
        return current != null ? current.scopeId : null;
    }

    /**
     * Adds a freshly created binding without rescanning the store.
     *
     * @return false if the binding belongs to another scope and was ignored
     */
    public boolean register(Binding binding) {
        Maps current = requireInitialized();
        if (!current.scopeId.equals(binding.getContainerId())) {
            log.debug("Skipping registration of binding {} for inactive scope {}",
                    binding.getId(), binding.getContainerId());
            return false;
        }
        current.put(IndexedBinding.of(binding));
        existenceCache.upsert(binding.getId(), binding.getCurrentStatus());
        return true;
    }

    public Optional<IndexedBinding> get(String bindingId) {
        Objects.requireNonNull(bindingId, "bindingId is required");
        return Optional.ofNullable(requireInitialized().byId.get(bindingId));
    }

    public Optional<BindingStatus> getStatus(String bindingId) {
        return get(bindingId).map(IndexedBinding::status);
    }

    public Optional<String> findByElementId(String elementId) {
        Objects.requireNonNull(elementId, "elementId is required");
        return Optional.ofNullable(requireInitialized().byElementId.get(elementId));
    }

    public Set<String> findByBlockId(String blockId) {
        Objects.requireNonNull(blockId, "blockId is required");
        Set<String> ids = requireInitialized().byBlockId.get(blockId);
        return ids != null ? Set.copyOf(ids) : Set.of();
    }

    public List<String> listByStatus(BindingStatus status) {
        return requireInitialized().byId.values().stream()
                .filter(entry -> entry.status() == status)
                .map(IndexedBinding::bindingId)
                .toList();
    }

    /**
     * Records an applied transition.
     */
    public void update(String bindingId, BindingStatus status, long version) {
        requireInitialized().byId.computeIfPresent(bindingId, (id, entry) -> entry.withStatus(status, version));
    }

    /**
     * Replaces the indexed slice of a binding with the given stored state.
     */
    public void refresh(Binding binding) {
        Maps current = requireInitialized();
        if (current.scopeId.equals(binding.getContainerId()) && binding.getLinkedElementId() != null) {
            current.put(IndexedBinding.of(binding));
        }
    }

    public int size() {
        Maps current = maps;
        return current != null ? current.byId.size() : 0;
    }

    public int elementIndexSize() {
        Maps current = maps;
        return current != null ? current.byElementId.size() : 0;
    }

    public int blockIndexSize() {
        Maps current = maps;
        return current != null ? current.byBlockId.size() : 0;
    }

    private Maps requireInitialized() {
        Maps current = maps;
        if (current == null) {
            throw new EngineNotInitializedException();
        }
        return current;
    }

    private static final class Maps {
        private final String scopeId;
        private final ConcurrentMap<String, IndexedBinding> byId = new ConcurrentHashMap<>();
        private final ConcurrentMap<String, String> byElementId = new ConcurrentHashMap<>();
        private final ConcurrentMap<String, Set<String>> byBlockId = new ConcurrentHashMap<>();

        private Maps(String scopeId) {
            this.scopeId = scopeId;
        }

        private void put(IndexedBinding entry) {
            byId.put(entry.bindingId(), entry);
            byElementId.put(entry.elementId(), entry.bindingId());
            if (entry.blockId() != null && !entry.blockId().isEmpty()) {
                byBlockId.computeIfAbsent(entry.blockId(), k -> ConcurrentHashMap.newKeySet())
                        .add(entry.bindingId());
            }
        }
    }
}
