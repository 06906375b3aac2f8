package com.existence.arbitration.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes each event to several publishers in order, isolating failures.
 * Typically combines the {@link InProcessEventBus} with a {@link NotificationDispatcher}.
 */
public class CompositeEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(CompositeEventPublisher.class);

    private final List<EventPublisher> delegates;

    public CompositeEventPublisher(List<EventPublisher> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static CompositeEventPublisher of(EventPublisher... delegates) {
        return new CompositeEventPublisher(List.of(delegates));
    }

    @Override
    public void publish(BindingEvent event) {
        for (EventPublisher delegate : delegates) {
            try {
                delegate.publish(event);
            } catch (Exception e) {
                log.warn("Publisher {} failed for event {}: {}", delegate, event.eventId(), e.getMessage());
            }
        }
    }
}
