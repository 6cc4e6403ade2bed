package org.iceforge.cloudstorage.event;

import java.time.Instant;
import java.util.Map;

/**
 * Structured event emitted by the core for an external metrics/logging sink.
 */
public record StorageEvent(Type type, String subject, Map<String, Object> attributes, Instant at) {

    public enum Type {
        PART_RETRIED("part_retried"),
        PART_FAILED("part_failed"),
        UPLOAD_COMPLETED("upload_completed"),
        UPLOAD_ABORTED("upload_aborted"),
        CACHE_HIT("cache_hit"),
        CACHE_MISS("cache_miss"),
        LOCK_TIMEOUT("lock_timeout");

        private final String eventName;

        Type(String eventName) {
            this.eventName = eventName;
        }

        public String eventName() {
            return eventName;
        }
    }

    public StorageEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static StorageEvent of(Type type, String subject, Map<String, Object> attributes) {
        return new StorageEvent(type, subject, attributes, Instant.now());
    }
}
