package org.iceforge.cloudstorage.lock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record LockHandle(String path, String token, Instant acquiredAt, Duration ttl) {

    public LockHandle {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    public Instant expiresAt() {
        return acquiredAt.plus(ttl);
    }
}
