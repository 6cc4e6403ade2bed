package org.iceforge.cloudstorage.cache;

/**
 * Read-only counters of a cache.
 */
public interface CacheMetrics {

    long hits();

    long misses();

    /** Live entries, including expired ones not yet purged. */
    int entries();
}
