package com.existence.arbitration.arbitration;

import com.existence.arbitration.api.Page;
import com.existence.arbitration.api.PageRequest;
import com.existence.arbitration.cache.CaffeineExistenceCache;
import com.existence.arbitration.core.BindingNotFoundException;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.InconsistencyType;
import com.existence.arbitration.core.model.ResolutionAction;
import com.existence.arbitration.core.model.StatusLogEntry;
import com.existence.arbitration.core.model.SuggestedResolution;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.engine.TransitionEngine;
import com.existence.arbitration.engine.TransitionPolicy;
import com.existence.arbitration.event.BindingEvent;
import com.existence.arbitration.event.BindingEventType;
import com.existence.arbitration.event.EventPublisher;
import com.existence.arbitration.index.MemoryIndex;
import com.existence.arbitration.lock.LocalBindingLock;
import com.existence.arbitration.metrics.NoOpMetricsService;
import com.existence.arbitration.store.InMemoryInconsistencyRepository;
import com.existence.arbitration.store.InMemoryStatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.existence.arbitration.BindingFixtures.SCOPE;
import static com.existence.arbitration.BindingFixtures.T0;
import static com.existence.arbitration.BindingFixtures.binding;
import static org.junit.jupiter.api.Assertions.*;

class ArbitrationServiceTest {

    private InMemoryStatusStore store;
    private InMemoryInconsistencyRepository repository;
    private MemoryIndex index;
    private List<BindingEvent> events;
    private ArbitrationService arbitrationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(T0.plusSeconds(600), ZoneOffset.UTC);
        store = new InMemoryStatusStore();
        repository = new InMemoryInconsistencyRepository();
        CaffeineExistenceCache cache = new CaffeineExistenceCache();
        index = new MemoryIndex(store, cache);
        events = new ArrayList<>();
        EventPublisher publisher = events::add;
        TransitionEngine engine = new TransitionEngine(store, index, cache, publisher, new LocalBindingLock(),
                TransitionPolicy.permissive(), new NoOpMetricsService(), clock);
        arbitrationService = new ArbitrationService(engine, index, repository, publisher,
                new NoOpMetricsService(), clock);

        store.insert(binding("b1", "e1", BindingStatus.PENDING));
        store.insert(binding("b2", "e2", BindingStatus.PENDING));
        store.insert(binding("b3", "e3", BindingStatus.VISIBLE));
        index.initialize(SCOPE);
    }

    @Test
    @DisplayName("Should tombstone a rejected binding and close its finding")
    void testReject() {
        Inconsistency finding = repository.save(finding("b1"));

        arbitrationService.reject("b1", "user-1", "spam");

        assertEquals(BindingStatus.DELETED, index.getStatus("b1").orElseThrow());
        Inconsistency closed = repository.findById(finding.getId()).orElseThrow();
        assertNotNull(closed.getResolvedAt());
        assertEquals(ResolutionAction.REJECTED, closed.getResolutionAction());
        assertEquals("rejected", closed.getResolutionAction().wireName());
        assertEquals("spam", closed.getResolutionNotes());

        StatusLogEntry row = store.findLogByBindingId("b1").get(0);
        assertEquals(TransitionType.ARBITRATION_REJECT, row.transitionType());
        assertEquals("Human rejected binding: spam", row.reason());

        BindingEvent last = events.get(events.size() - 1);
        assertEquals(BindingEventType.REJECTED, last.type());
        assertEquals("spam", last.reason());
    }

    @Test
    @DisplayName("Should make an approved binding visible and close its finding")
    void testApprove() {
        Inconsistency finding = repository.save(finding("b1"));

        arbitrationService.approve("b1", "user-1");

        assertEquals(BindingStatus.VISIBLE, index.getStatus("b1").orElseThrow());
        Inconsistency closed = repository.findById(finding.getId()).orElseThrow();
        assertEquals(ResolutionAction.APPROVED, closed.getResolutionAction());
        assertEquals("Binding approved by human arbitration", closed.getResolutionNotes());
        assertEquals(List.of(BindingEventType.STATUS_CHANGED, BindingEventType.APPROVED),
                events.stream().map(BindingEvent::type).toList());
    }

    @Test
    @DisplayName("Should only close the most recent open finding")
    void testClosesLatestOnly() {
        Inconsistency older = repository.save(finding("b1"));
        Inconsistency newer = repository.save(finding("b1"));

        arbitrationService.approve("b1", "user-1");

        assertTrue(repository.findById(older.getId()).orElseThrow().isOpen());
        assertFalse(repository.findById(newer.getId()).orElseThrow().isOpen());
    }

    @Test
    @DisplayName("Should succeed when there is no open finding")
    void testNoFinding() {
        assertDoesNotThrow(() -> arbitrationService.approve("b2", "user-1"));
        assertEquals(BindingStatus.VISIBLE, index.getStatus("b2").orElseThrow());
    }

    @Test
    @DisplayName("Should list open findings of pending bindings only")
    void testPendingReviews() {
        repository.save(finding("b1"));
        repository.save(finding("b2"));
        repository.save(finding("b3"));

        Page<Inconsistency> page = arbitrationService.getPendingReviews(PageRequest.of(0, 10));

        assertEquals(2, page.totalElements());
        assertEquals(List.of("b1", "b2"), page.content().stream().map(Inconsistency::getBindingId).toList());
        assertEquals(1, arbitrationService.getOpenInconsistencies("b3").size());
    }

    @Test
    @DisplayName("Should validate the user and binding")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> arbitrationService.approve("b1", " "));
        assertThrows(BindingNotFoundException.class, () -> arbitrationService.reject("nope", "user-1", "spam"));
    }

    private static Inconsistency finding(String bindingId) {
        return Inconsistency.builder()
                .bindingId(bindingId)
                .type(InconsistencyType.STATUS_MISMATCH)
                .detectedAt(T0)
                .bindingStatus(BindingStatus.HIDDEN)
                .suggestedResolution(SuggestedResolution.SET_VISIBLE)
                .resolutionConfidence(0.85)
                .build();
    }
}
