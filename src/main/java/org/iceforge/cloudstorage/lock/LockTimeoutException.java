package org.iceforge.cloudstorage.lock;

import org.iceforge.cloudstorage.StorageException;

import java.time.Duration;

public class LockTimeoutException extends StorageException {

    private final String path;

    public LockTimeoutException(String path, Duration waited) {
        super("Timed out after " + waited + " waiting for lock on " + path);
        this.path = path;
    }

    public LockTimeoutException(String path, Throwable cause) {
        super("Interrupted while waiting for lock on " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
