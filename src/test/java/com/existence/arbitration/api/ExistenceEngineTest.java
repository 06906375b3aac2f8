package com.existence.arbitration.api;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.EntityState;
import com.existence.arbitration.core.model.NewBinding;
import com.existence.arbitration.core.model.Provenance;
import com.existence.arbitration.core.model.StatusLogEntry;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.event.BindingEvent;
import com.existence.arbitration.event.NotificationSink;
import com.existence.arbitration.index.EngineNotInitializedException;
import com.existence.arbitration.reconcile.ReconcileResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.existence.arbitration.BindingFixtures.SCOPE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ExistenceEngine")
class ExistenceEngineTest {

    private final Map<String, EntityState> elements = new ConcurrentHashMap<>();
    private final Map<String, EntityState> marks = new ConcurrentHashMap<>();
    private ExistenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = newEngine(null);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private ExistenceEngine newEngine(NotificationSink sink) {
        ExistenceEngine.Builder builder = ExistenceEngine.builder()
                .elementSignals(containerId -> Map.copyOf(elements))
                .markSignals(documentId -> Map.copyOf(marks));
        if (sink != null) {
            builder.notificationSink(sink);
        }
        return builder.build();
    }

    private Binding linkByUser(String elementId) {
        elements.put(elementId, EntityState.PRESENT);
        marks.put("blk-" + elementId, EntityState.PRESENT);
        return engine.registerBinding(NewBinding.byUser(SCOPE, "doc-1", elementId, "blk-" + elementId));
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("User bindings start visible and are indexed")
        void userBinding() {
            engine.initialize(SCOPE);

            Binding binding = linkByUser("e1");

            assertEquals(BindingStatus.VISIBLE, binding.getCurrentStatus());
            assertEquals(0, binding.getVersion());
            assertEquals(List.of(binding.getId()), engine.getBindingsByStatus(BindingStatus.VISIBLE));
            assertEquals(binding.getId(), engine.getBindingByElementId("e1").orElseThrow());
            assertTrue(engine.getExistence(binding.getId()).isPresent());
        }

        @Test
        @DisplayName("Low-confidence AI bindings start pending")
        void aiBinding() {
            engine.initialize(SCOPE);

            Binding unsure = engine.registerBinding(new NewBinding(SCOPE, "doc-1", "e1", "blk-1", null,
                    Provenance.AI, 0.5));
            Binding confident = engine.registerBinding(new NewBinding(SCOPE, "doc-1", "e2", "blk-2", null,
                    Provenance.AI, 0.9));

            assertEquals(BindingStatus.PENDING, unsure.getCurrentStatus());
            assertEquals(BindingStatus.VISIBLE, confident.getCurrentStatus());
        }

        @Test
        @DisplayName("Bindings registered before initialization are loaded by initialize")
        void beforeInitialize() {
            Binding binding = linkByUser("e1");
            assertFalse(engine.isInitialized());

            assertEquals(1, engine.initialize(SCOPE));
            assertEquals(BindingStatus.VISIBLE, engine.getStatus(binding.getId()).orElseThrow());
        }

        @Test
        @DisplayName("Bindings of another scope are stored but not indexed")
        void otherScope() {
            engine.initialize(SCOPE);

            Binding other = engine.registerBinding(NewBinding.byUser("canvas-2", "doc-9", "e9", "blk-9"));

            assertTrue(engine.getBinding(other.getId()).isPresent());
            assertTrue(engine.getStatus(other.getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Element deletion flow")
    class ElementDeletion {

        @Test
        @DisplayName("Deleting a canvas element hides its binding and logs the change")
        void hideByElement() {
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");
            List<BindingEvent> events = new CopyOnWriteArrayList<>();
            engine.subscribe(events::add);

            int changed = engine.hideByElementIds(List.of("e1", "not-bound"), "user-1");

            assertEquals(1, changed);
            assertEquals(BindingStatus.HIDDEN, engine.getStatus(binding.getId()).orElseThrow());
            assertEquals(BindingStatus.HIDDEN, engine.getBinding(binding.getId()).orElseThrow().getCurrentStatus());
            List<StatusLogEntry> history = engine.getStatusHistory(binding.getId());
            assertEquals(1, history.size());
            assertEquals(TransitionType.USER_HIDE, history.get(0).transitionType());
            assertEquals(1, events.size());
            assertEquals(BindingStatus.VISIBLE, events.get(0).previousStatus());
        }

        @Test
        @DisplayName("Undoing the deletion shows the binding again")
        void undo() {
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");
            engine.hideByElementIds(List.of("e1"), "user-1");

            assertEquals(1, engine.showByElementIds(List.of("e1"), "user-1"));
            assertEquals(0, engine.showByElementIds(List.of("e1"), "user-1"));
            assertEquals(BindingStatus.VISIBLE, engine.getStatus(binding.getId()).orElseThrow());
            assertEquals(2, engine.getStatusHistory(binding.getId()).size());
        }

        @Test
        @DisplayName("Unsubscribed listeners receive nothing")
        void unsubscribe() {
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");
            List<BindingEvent> events = new CopyOnWriteArrayList<>();
            com.existence.arbitration.event.BindingEventListener listener = events::add;
            engine.subscribe(listener);
            engine.unsubscribe(listener);

            engine.hide(binding.getId(), "user-1");

            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Notification sink receives the status signals")
        void notifications() throws Exception {
            engine.close();
            NotificationSink sink = mock(NotificationSink.class);
            engine = newEngine(sink);
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");

            engine.softDelete(binding.getId(), "user-1");

            verify(sink, timeout(2_000)).deliver(eq("binding:status-changed"), anyString());
            verify(sink, timeout(2_000)).deliver(eq("binding:deleted"), anyString());
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("A visible binding of a deleted element is hidden by reconciliation")
        void autoFix() {
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");
            elements.put("e1", EntityState.DELETED);

            ReconcileResult result = engine.reconcile(SCOPE, true);

            assertEquals(1, result.autoFixed());
            assertEquals(0, result.requiresHumanReview());
            assertEquals(BindingStatus.HIDDEN, engine.getStatus(binding.getId()).orElseThrow());
            assertEquals(TransitionType.SYSTEM_RECONCILE,
                    engine.getStatusHistory(binding.getId()).get(0).transitionType());
        }

        @Test
        @DisplayName("Without auto-fix the finding waits for review and can be rejected")
        void reviewThenReject() {
            engine.initialize(SCOPE);
            Binding binding = linkByUser("e1");
            elements.put("e1", EntityState.DELETED);

            ReconcileResult result = engine.reconcile(false);

            assertEquals(1, result.requiresHumanReview());
            assertEquals(BindingStatus.PENDING, engine.getStatus(binding.getId()).orElseThrow());
            assertEquals(1, engine.getPendingReviews(PageRequest.of(0, 10)).totalElements());

            engine.reject(binding.getId(), "user-1", "stale link");

            assertEquals(BindingStatus.DELETED, engine.getStatus(binding.getId()).orElseThrow());
            assertTrue(engine.getOpenInconsistencies(binding.getId()).isEmpty());
            assertEquals(0, engine.getPendingReviews(PageRequest.of(0, 10)).totalElements());
        }

        @Test
        @DisplayName("A pending AI binding can be approved")
        void approve() {
            engine.initialize(SCOPE);
            Binding binding = engine.registerBinding(new NewBinding(SCOPE, "doc-1", "e1", "blk-1", null,
                    Provenance.AI, 0.4));

            engine.approve(binding.getId(), "user-1");

            assertEquals(BindingStatus.VISIBLE, engine.getStatus(binding.getId()).orElseThrow());
        }

        @Test
        @DisplayName("Reconciling another scope or an uninitialized engine fails")
        void scopeChecks() {
            assertThrows(EngineNotInitializedException.class, () -> engine.reconcile(true));
            assertThrows(EngineNotInitializedException.class, () -> engine.scheduleReconciliation());

            engine.initialize(SCOPE);

            assertThrows(IllegalArgumentException.class, () -> engine.reconcile("canvas-2", true));
        }
    }

    @Test
    @DisplayName("Engine status reports index sizes")
    void engineStatus() {
        EngineStatus before = engine.getEngineStatus();
        assertFalse(before.initialized());
        assertNull(before.scopeId());

        engine.initialize(SCOPE);
        linkByUser("e1");
        linkByUser("e2");

        EngineStatus after = engine.getEngineStatus();
        assertTrue(after.initialized());
        assertEquals(SCOPE, after.scopeId());
        assertEquals(2, after.indexedBindings());
        assertEquals(2, after.elementIndexSize());
        assertEquals(2, after.blockIndexSize());
        assertEquals(0, after.openInconsistencies());
    }

    @Test
    @DisplayName("Builder requires an element signal source")
    void builderValidation() {
        assertThrows(IllegalStateException.class, () -> ExistenceEngine.builder().build());
    }

    @Test
    @DisplayName("Strict transitions are enabled through options")
    void strictOption() {
        engine.close();
        engine = ExistenceEngine.builder()
                .elementSignals(containerId -> Map.copyOf(elements))
                .options(ArbitrationOptions.builder().strictTransitions(true).build())
                .build();
        engine.initialize(SCOPE);
        Binding binding = linkByUser("e1");
        engine.softDelete(binding.getId(), "user-1");

        assertThrows(com.existence.arbitration.engine.IllegalTransitionException.class,
                () -> engine.hide(binding.getId(), "user-1"));
        assertTrue(engine.restore(binding.getId(), "user-1").applied());
    }
}
