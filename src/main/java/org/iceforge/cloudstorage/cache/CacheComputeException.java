package org.iceforge.cloudstorage.cache;

import org.iceforge.cloudstorage.StorageException;

/**
 * A cache population failed or did not finish in time. Every caller waiting on the same key
 * sees the same underlying cause.
 */
public class CacheComputeException extends StorageException {

    private final String key;

    public CacheComputeException(String key, Throwable cause) {
        super("Computing cache entry '" + key + "' failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.key = key;
    }

    public CacheComputeException(String key, String message) {
        super("Computing cache entry '" + key + "' failed: " + message);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
