package com.existence.arbitration.detect;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.EntityState;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.InconsistencyType;
import com.existence.arbitration.core.model.SuggestedResolution;
import com.existence.arbitration.store.InMemoryStatusStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.existence.arbitration.BindingFixtures.SCOPE;
import static com.existence.arbitration.BindingFixtures.T0;
import static com.existence.arbitration.BindingFixtures.binding;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InconsistencyDetector")
class InconsistencyDetectorTest {

    private InMemoryStatusStore store;
    private Map<String, EntityState> elements;
    private Map<String, EntityState> marks;
    private InconsistencyDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryStatusStore();
        elements = new HashMap<>();
        marks = new HashMap<>();
        detector = new InconsistencyDetector(store, scope -> elements, document -> marks,
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Element rules")
    class ElementRules {

        @Test
        @DisplayName("Visible binding whose element is deleted yields one status mismatch at 0.95")
        void visibleButDeleted() {
            store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
            elements.put("e1", EntityState.DELETED);
            marks.put("block-e1", EntityState.PRESENT);

            List<Inconsistency> findings = detector.detect(SCOPE);

            assertEquals(1, findings.size());
            Inconsistency finding = findings.get(0);
            assertEquals(InconsistencyType.STATUS_MISMATCH, finding.getType());
            assertEquals(0.95, finding.getResolutionConfidence());
            assertEquals("set status=hidden", finding.getSuggestedResolution().label());
            assertEquals(Boolean.TRUE, finding.getElementDeleted());
            assertEquals(T0, finding.getDetectedAt());
            assertEquals("deleted", finding.getSnapshot().get("elementState"));
        }

        @Test
        @DisplayName("Hidden binding whose element is present suggests showing at 0.85")
        void hiddenButPresent() {
            store.insert(binding("b1", "e1", BindingStatus.HIDDEN));
            elements.put("e1", EntityState.PRESENT);
            marks.put("block-e1", EntityState.PRESENT);

            Inconsistency finding = detector.detect(SCOPE).get(0);

            assertEquals(InconsistencyType.STATUS_MISMATCH, finding.getType());
            assertEquals(SuggestedResolution.SET_VISIBLE, finding.getSuggestedResolution());
            assertEquals(0.85, finding.getResolutionConfidence());
        }

        @Test
        @DisplayName("Missing element yields missing-element, or orphaned when the mark is gone too")
        void missingElement() {
            store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
            store.insert(binding("b2", "e2", BindingStatus.VISIBLE));
            marks.put("block-e1", EntityState.PRESENT);

            Map<String, Inconsistency> byBinding = new HashMap<>();
            detector.detect(SCOPE).forEach(i -> byBinding.put(i.getBindingId(), i));

            assertEquals(InconsistencyType.MISSING_ELEMENT, byBinding.get("b1").getType());
            assertEquals(0.90, byBinding.get("b1").getResolutionConfidence());
            assertEquals(InconsistencyType.ORPHANED, byBinding.get("b2").getType());
            assertEquals(0.95, byBinding.get("b2").getResolutionConfidence());
            assertEquals(SuggestedResolution.SOFT_DELETE, byBinding.get("b2").getSuggestedResolution());
        }
    }

    @Nested
    @DisplayName("Mark rules")
    class MarkRules {

        @Test
        @DisplayName("Deleted mark under a present element is a ghost binding")
        void ghostBinding() {
            store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
            elements.put("e1", EntityState.PRESENT);
            marks.put("block-e1", EntityState.DELETED);

            Inconsistency finding = detector.detect(SCOPE).get(0);

            assertEquals(InconsistencyType.GHOST_BINDING, finding.getType());
            assertEquals(0.80, finding.getResolutionConfidence());
            assertEquals(Boolean.FALSE, finding.getMarkExists());
        }

        @Test
        @DisplayName("Absent mark under a present element is a missing mark")
        void missingMark() {
            store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
            elements.put("e1", EntityState.PRESENT);

            Inconsistency finding = detector.detect(SCOPE).get(0);

            assertEquals(InconsistencyType.MISSING_MARK, finding.getType());
            assertEquals(0.70, finding.getResolutionConfidence());
        }

        @Test
        @DisplayName("Without a mark source only element rules apply")
        void noMarkSource() {
            InconsistencyDetector elementOnly = new InconsistencyDetector(store, scope -> elements);
            store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
            elements.put("e1", EntityState.PRESENT);

            assertTrue(elementOnly.detect(SCOPE).isEmpty());
        }
    }

    @Test
    @DisplayName("Consistent, deleted and pending bindings produce no findings")
    void skipsSettledBindings() {
        store.insert(binding("b1", "e1", BindingStatus.VISIBLE));
        store.insert(binding("b2", "e2", BindingStatus.DELETED));
        store.insert(binding("b3", "e3", BindingStatus.PENDING));
        elements.put("e1", EntityState.PRESENT);
        marks.put("block-e1", EntityState.PRESENT);

        assertTrue(detector.detect(SCOPE).isEmpty());
    }

    @Test
    @DisplayName("Mark key prefers the mark id over the block id")
    void markKey() {
        store.insert(Binding.builder(binding("b1", "e1", BindingStatus.VISIBLE)).linkedMarkId("m-1").build());
        elements.put("e1", EntityState.PRESENT);
        marks.put("block-e1", EntityState.PRESENT);
        marks.put("m-1", EntityState.DELETED);

        assertEquals(InconsistencyType.GHOST_BINDING, detector.detect(SCOPE).get(0).getType());
    }

    @Test
    @DisplayName("Unreadable signals raise SignalUnavailableException")
    void signalFailure() {
        InconsistencyDetector broken = new InconsistencyDetector(store, scope -> {
            throw new IOException("canvas offline");
        });

        SignalUnavailableException e = assertThrows(SignalUnavailableException.class,
                () -> broken.detect(SCOPE));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
