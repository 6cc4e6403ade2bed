package org.iceforge.cloudstorage.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fans events out to every registered {@link StorageEventListener}. A failing listener is
 * logged and skipped; it never fails the operation that emitted the event.
 */
@Component
public class StorageEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(StorageEventPublisher.class);

    private final List<StorageEventListener> listeners;

    public StorageEventPublisher(List<StorageEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static StorageEventPublisher noop() {
        return new StorageEventPublisher(List.of());
    }

    public void publish(StorageEvent.Type type, String subject, Map<String, Object> attributes) {
        if (listeners.isEmpty()) return;
        StorageEvent event = StorageEvent.of(type, subject, attributes);
        for (StorageEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Storage event listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), type.eventName(), e.toString());
            }
        }
    }

    public void publish(StorageEvent.Type type, String subject) {
        publish(type, subject, Map.of());
    }
}
