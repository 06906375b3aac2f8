package com.existence.arbitration.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process fan-out to registered listeners.
 * A failing listener is logged and does not prevent delivery to the others.
 */
public class InProcessEventBus implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(InProcessEventBus.class);

    private final List<BindingEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(BindingEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(BindingEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public void publish(BindingEvent event) {
        for (BindingEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Listener {} failed on event {} for binding {}: {}",
                        listener, event.type(), event.bindingId(), e.getMessage());
            }
        }
    }
}
