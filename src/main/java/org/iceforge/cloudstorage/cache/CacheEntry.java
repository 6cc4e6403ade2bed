package org.iceforge.cloudstorage.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A cached value with the tags it can be invalidated by. {@code stamp} orders writes against
 * in-flight computations and invalidations.
 */
public record CacheEntry(String key, Object value, Set<String> tags, Instant expiresAt, long stamp) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(expiresAt, "expiresAt");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
