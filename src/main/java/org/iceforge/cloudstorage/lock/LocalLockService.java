package org.iceforge.cloudstorage.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock implementation for local object-store mode.
 *
 * <p>This is not distributed and only provides single-JVM semantics. That's fine for
 * integration tests and "get started" setups.
 */
@Service
@ConditionalOnProperty(prefix = "cloudstorage", name = "store", havingValue = "local")
public class LocalLockService implements LockService {

    private static final Logger log = LoggerFactory.getLogger(LocalLockService.class);

    private record Lock(String token, Instant expiresAt) {}

    private final ConcurrentHashMap<String, Lock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public LocalLockService() {
        this(Clock.systemUTC());
    }

    public LocalLockService(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public boolean tryAcquire(String path, String token, Duration ttl) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(token);
        Instant now = clock.instant();
        Lock wanted = new Lock(token, now.plus(ttl));

        Lock holder = locks.compute(path, (p, existing) ->
                existing == null || !existing.expiresAt().isAfter(now) ? wanted : existing);
        if (holder == wanted) {
            return true;
        }
        log.debug("Local lock contention for {}", path);
        return false;
    }

    @Override
    public boolean release(String path, String token) {
        boolean[] removed = {false};
        locks.computeIfPresent(path, (p, existing) -> {
            if (existing.token().equals(token)) {
                removed[0] = true;
                return null;
            }
            return existing;
        });
        return removed[0];
    }
}
