package com.existence.arbitration.event;

import com.existence.arbitration.core.model.BindingStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.existence.arbitration.BindingFixtures.SCOPE;
import static com.existence.arbitration.BindingFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Binding events")
class BindingEventTest {

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("Hidden status emits status-changed then hidden")
        void hidden() {
            BindingEvent event = changed(BindingStatus.HIDDEN, BindingStatus.VISIBLE);

            assertEquals(List.of(BindingEventType.STATUS_CHANGED, BindingEventType.HIDDEN), event.signals());
            assertEquals("binding:status-changed", event.signals().get(0).signalName());
        }

        @Test
        @DisplayName("Leaving a tombstone also emits restored")
        void restored() {
            assertEquals(List.of(BindingEventType.STATUS_CHANGED, BindingEventType.SHOWN, BindingEventType.RESTORED),
                    changed(BindingStatus.VISIBLE, BindingStatus.DELETED).signals());
            assertEquals(List.of(BindingEventType.STATUS_CHANGED, BindingEventType.SHOWN),
                    changed(BindingStatus.VISIBLE, BindingStatus.HIDDEN).signals());
        }

        @Test
        @DisplayName("Arbitration events emit only their own signal")
        void arbitration() {
            BindingEvent event = BindingEvent.arbitrated(BindingEventType.REJECTED, SCOPE, "b1", "e1",
                    BindingStatus.DELETED, "user-1", "spam", T0);

            assertEquals(List.of(BindingEventType.REJECTED), event.signals());
            assertThrows(IllegalArgumentException.class, () -> BindingEvent.arbitrated(
                    BindingEventType.HIDDEN, SCOPE, "b1", "e1", BindingStatus.HIDDEN, "user-1", null, T0));
        }
    }

    @Nested
    @DisplayName("Payload")
    class Payload {

        @Test
        @DisplayName("JSON carries wire names and omits an absent reason")
        void json() throws Exception {
            BindingEvent event = BindingEvent.statusChanged(SCOPE, "b1", "e1", BindingStatus.HIDDEN,
                    BindingStatus.VISIBLE, "user-1", null, T0);

            JsonNode node = new ObjectMapper().readTree(EventJson.toJson(event));

            assertEquals("b1", node.get("bindingId").asText());
            assertEquals("hidden", node.get("status").asText());
            assertEquals("visible", node.get("previousStatus").asText());
            assertEquals(T0.toString(), node.get("timestamp").asText());
            assertFalse(node.has("reason"));
        }

        @Test
        @DisplayName("Payload keeps the reason of a rejection")
        void reason() {
            Map<String, Object> payload = EventJson.payload(BindingEvent.arbitrated(BindingEventType.REJECTED,
                    SCOPE, "b1", "e1", BindingStatus.DELETED, "user-1", "spam", T0));

            assertEquals("spam", payload.get("reason"));
            assertEquals("deleted", payload.get("status"));
        }
    }

    @Nested
    @DisplayName("Publishers")
    class Publishers {

        @Test
        @DisplayName("In-process bus isolates a failing listener")
        void busIsolatesFailures() {
            InProcessEventBus bus = new InProcessEventBus();
            List<BindingEvent> received = new ArrayList<>();
            bus.subscribe(event -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe(received::add);

            assertDoesNotThrow(() -> bus.publish(changed(BindingStatus.HIDDEN, BindingStatus.VISIBLE)));
            assertEquals(1, received.size());
            assertEquals(2, bus.listenerCount());
        }

        @Test
        @DisplayName("Composite publisher fans out in order and survives a failing delegate")
        void composite() {
            List<String> calls = new ArrayList<>();
            EventPublisher failing = event -> {
                calls.add("failing");
                throw new IllegalStateException("boom");
            };
            CompositeEventPublisher composite = CompositeEventPublisher.of(
                    event -> calls.add("first"), failing, event -> calls.add("last"));

            assertDoesNotThrow(() -> composite.publish(changed(BindingStatus.HIDDEN, BindingStatus.VISIBLE)));
            assertEquals(List.of("first", "failing", "last"), calls);
        }
    }

    private static BindingEvent changed(BindingStatus status, BindingStatus previous) {
        return BindingEvent.statusChanged(SCOPE, "b1", "e1", status, previous, "user-1", null, T0);
    }
}
