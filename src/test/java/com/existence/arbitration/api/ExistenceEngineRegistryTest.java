package com.existence.arbitration.api;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.NewBinding;
import com.existence.arbitration.store.InMemoryStatusStore;
import com.existence.arbitration.store.StatusStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExistenceEngineRegistryTest {

    private final StatusStore store = new InMemoryStatusStore();
    private final AtomicInteger created = new AtomicInteger();
    private ExistenceEngineRegistry registry;

    private ExistenceEngine newEngine(String scopeId) {
        created.incrementAndGet();
        return ExistenceEngine.builder()
                .statusStore(store)
                .elementSignals(containerId -> Map.of())
                .options(ArbitrationOptions.builder().reconcileInterval(Duration.ofHours(1)).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void scopesGetSeparateInitializedEngines() {
        registry = new ExistenceEngineRegistry(this::newEngine);

        ExistenceEngine first = registry.forScope("canvas-1");
        ExistenceEngine second = registry.forScope("canvas-2");

        assertNotSame(first, second);
        assertSame(first, registry.forScope("canvas-1"));
        assertEquals(2, created.get());
        assertTrue(first.isInitialized());
        assertEquals(Set.of("canvas-1", "canvas-2"), registry.activeScopes());
    }

    @Test
    void bindingsStayInTheirScope() {
        registry = new ExistenceEngineRegistry(this::newEngine);
        ExistenceEngine first = registry.forScope("canvas-1");
        ExistenceEngine second = registry.forScope("canvas-2");

        Binding binding = first.registerBinding(NewBinding.byUser("canvas-1", "doc-1", "e1", "blk-1"));
        first.hide(binding.getId(), "user-1");

        assertEquals(List.of(binding.getId()), first.getBindingsByStatus(BindingStatus.HIDDEN));
        assertTrue(second.getBindingsByStatus(BindingStatus.HIDDEN).isEmpty());
        assertTrue(second.getStatus(binding.getId()).isEmpty());
    }

    @Test
    void refreshReloadsFromTheStore() {
        registry = new ExistenceEngineRegistry(this::newEngine);
        registry.forScope("canvas-1");
        store.insert(Binding.builder().id("b-ext").containerId("canvas-1").linkedElementId("e1")
                .currentStatus(BindingStatus.VISIBLE).build());

        assertEquals(1, registry.refresh("canvas-1"));
        assertEquals(BindingStatus.VISIBLE, registry.forScope("canvas-1").getStatus("b-ext").orElseThrow());
    }

    @Test
    void closeForgetsTheScope() {
        registry = new ExistenceEngineRegistry(this::newEngine);
        registry.forScope("canvas-1");

        registry.close("canvas-1");

        assertTrue(registry.find("canvas-1").isEmpty());
        registry.forScope("canvas-1");
        assertEquals(2, created.get());
    }

    @Test
    void schedulesReconciliationWhenAsked() {
        registry = new ExistenceEngineRegistry(this::newEngine, true);

        ExistenceEngine engine = registry.forScope("canvas-1");

        assertTrue(engine.isInitialized());
        assertDoesNotThrow(() -> registry.close());
    }
}
