package com.existence.arbitration.rest.dto;

import com.existence.arbitration.core.model.ActorType;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.InconsistencyType;
import com.existence.arbitration.core.model.StatusLogEntry;
import com.existence.arbitration.core.model.SuggestedResolution;
import com.existence.arbitration.core.model.TransitionType;
import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.reconcile.ReconcileResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.existence.arbitration.BindingFixtures.T0;
import static com.existence.arbitration.BindingFixtures.binding;
import static org.junit.jupiter.api.Assertions.*;

class DtoValidationTest {

    // ========== Request validation ==========

    @Test
    @DisplayName("Should reject ActorRequest with blank actor")
    void testActorRequest() {
        assertEquals("user-1", new ActorRequest("user-1").actorId());
        assertThrows(IllegalArgumentException.class, () -> new ActorRequest(null));
        assertThrows(IllegalArgumentException.class, () -> new ActorRequest("  "));
    }

    @Test
    @DisplayName("Should require both user and reason for RejectRequest")
    void testRejectRequest() {
        assertEquals("spam", new RejectRequest("user-1", "spam").reason());
        assertThrows(IllegalArgumentException.class, () -> new RejectRequest(null, "spam"));
        assertThrows(IllegalArgumentException.class, () -> new RejectRequest("user-1", " "));
    }

    @Test
    @DisplayName("Should reject ElementIdsRequest without ids and copy the list")
    void testElementIdsRequest() {
        assertThrows(IllegalArgumentException.class, () -> new ElementIdsRequest(List.of(), "user-1"));
        assertThrows(IllegalArgumentException.class, () -> new ElementIdsRequest(null, "user-1"));
        assertThrows(IllegalArgumentException.class, () -> new ElementIdsRequest(List.of("e1"), null));

        ElementIdsRequest request = new ElementIdsRequest(new java.util.ArrayList<>(List.of("e1")), "user-1");
        assertThrows(UnsupportedOperationException.class, () -> request.elementIds().add("e2"));
    }

    // ========== Response mapping ==========

    @Test
    @DisplayName("Should map statuses to wire names")
    void testBindingAndTransitionResponses() {
        BindingResponse binding = BindingResponse.from(binding("b1", "e1", BindingStatus.HIDDEN));
        assertEquals("hidden", binding.status());
        assertEquals("block-e1", binding.linkedBlockId());
        assertEquals("user", binding.provenance());

        TransitionResponse transition = TransitionResponse.from(
                new TransitionResult("b1", BindingStatus.DELETED, BindingStatus.VISIBLE, true));
        assertEquals("deleted", transition.previousStatus());
        assertEquals("visible", transition.status());
        assertTrue(transition.applied());
    }

    @Test
    @DisplayName("Should map status log rows")
    void testStatusLogResponse() {
        StatusLogResponse row = StatusLogResponse.from(StatusLogEntry.builder()
                .bindingId("b1")
                .status(BindingStatus.HIDDEN)
                .previousStatus(BindingStatus.VISIBLE)
                .transitionType(TransitionType.SYSTEM_RECONCILE)
                .actorType(ActorType.SYSTEM)
                .actorId("system:reconciler")
                .timestamp(T0)
                .metadata(Map.of("inconsistencyId", "i1"))
                .build());

        assertEquals("system_reconcile", row.transitionType());
        assertEquals("system", row.actorType());
        assertEquals("visible", row.previousStatus());
    }

    @Test
    @DisplayName("Should summarize a reconciliation pass")
    void testReconcileResponse() {
        Inconsistency finding = Inconsistency.builder()
                .id("i1")
                .bindingId("b1")
                .type(InconsistencyType.STATUS_MISMATCH)
                .detectedAt(T0)
                .bindingStatus(BindingStatus.VISIBLE)
                .elementDeleted(true)
                .suggestedResolution(SuggestedResolution.SET_HIDDEN)
                .resolutionConfidence(0.95)
                .build();

        ReconcileResponse response = ReconcileResponse.from(new ReconcileResult("canvas-1", 1, 0, List.of(finding)));

        assertEquals(1, response.total());
        InconsistencyResponse item = response.inconsistencies().get(0);
        assertEquals("status-mismatch", item.type());
        assertEquals("set status=hidden", item.suggestedResolution());
        assertNull(item.resolutionAction());
    }
}
