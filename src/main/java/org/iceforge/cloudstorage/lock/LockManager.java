package org.iceforge.cloudstorage.lock;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.event.StorageEvent;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Mutual exclusion and optimistic versioning for store paths.
 * <p>
 * A path is guarded either by exclusive locks or by compare-and-swap, never both: the mode a
 * path was last used with sticks for the mode retention (or for as long as a lock taken on it
 * may live, if longer), and a use of the other mode within that window fails with
 * {@link ConcurrencyPolicyViolationException}. Idle paths are forgotten after that.
 */
@Service
public class LockManager {
    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    private static final long INITIAL_POLL_MILLIS = 25L;
    private static final long MAX_POLL_MILLIS = 500L;

    private final LockService locks;
    private final ObjectStoreClient store;
    private final StorageEventPublisher events;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration defaultMaxWait;
    private final Duration modeRetention;
    private final ConcurrentHashMap<String, ModeClaim> modes = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweep;

    @Autowired
    public LockManager(LockService locks, ObjectStoreClient store, StorageEventPublisher events, CloudStorageProperties props) {
        this(locks, store, events, Clock.systemUTC(), props.getLock().getTtl(), props.getLock().getMaxWait(),
                props.getLock().getModeRetention());
    }

    public LockManager(LockService locks, ObjectStoreClient store, StorageEventPublisher events, Clock clock,
                       Duration defaultTtl, Duration defaultMaxWait) {
        this(locks, store, events, clock, defaultTtl, defaultMaxWait, defaultTtl);
    }

    public LockManager(LockService locks, ObjectStoreClient store, StorageEventPublisher events, Clock clock,
                       Duration defaultTtl, Duration defaultMaxWait, Duration modeRetention) {
        if (modeRetention == null || modeRetention.isNegative() || modeRetention.isZero()) {
            throw new IllegalArgumentException("modeRetention must be positive");
        }
        this.locks = Objects.requireNonNull(locks);
        this.store = Objects.requireNonNull(store);
        this.events = Objects.requireNonNull(events);
        this.clock = Objects.requireNonNull(clock);
        this.defaultTtl = Objects.requireNonNull(defaultTtl);
        this.defaultMaxWait = Objects.requireNonNull(defaultMaxWait);
        this.modeRetention = modeRetention;
        this.nextSweep = new AtomicReference<>(this.clock.instant().plus(modeRetention));
    }

    public Duration defaultTtl() { return defaultTtl; }
    public Duration defaultMaxWait() { return defaultMaxWait; }

    /**
     * Blocks until the lock on {@code path} is held, polling the backend with backoff.
     *
     * @throws LockTimeoutException if the lock could not be taken within {@code maxWait}
     */
    public LockHandle acquire(String path, Duration ttl, Duration maxWait) {
        Objects.requireNonNull(path, "path");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        claim(path, ConcurrencyMode.EXCLUSIVE, maxWait.plus(ttl));

        String token = UUID.randomUUID().toString();
        Instant start = clock.instant();
        Instant deadline = start.plus(maxWait);
        long poll = INITIAL_POLL_MILLIS;
        int attempts = 0;

        while (true) {
            attempts++;
            if (locks.tryAcquire(path, token, ttl)) {
                logger.debug("Acquired lock on {} after {} attempt(s)", path, attempts);
                return new LockHandle(path, token, clock.instant(), ttl);
            }
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            if (remaining <= 0) {
                events.publish(StorageEvent.Type.LOCK_TIMEOUT, path,
                        Map.of("waitedMillis", maxWait.toMillis(), "attempts", attempts));
                throw new LockTimeoutException(path, maxWait);
            }
            try {
                Thread.sleep(Math.min(poll, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(path, e);
            }
            poll = Math.min(MAX_POLL_MILLIS, poll * 2);
        }
    }

    /**
     * Idempotent. Releasing an expired or already released handle never removes another
     * holder's lock.
     */
    public void release(LockHandle handle) {
        if (handle == null) {
            return;
        }
        if (!locks.release(handle.path(), handle.token())) {
            logger.debug("Lock on {} was no longer held by {} at release", handle.path(), handle.token());
        }
    }

    public <T> T withExclusiveAccess(String path, Duration ttl, Duration maxWait, Supplier<T> fn) {
        LockHandle handle = acquire(path, ttl, maxWait);
        try {
            return fn.get();
        } finally {
            try {
                release(handle);
            } catch (RuntimeException e) {
                // lock expires server-side
                logger.warn("Failed to release lock on {}: {}", path, e.getMessage());
            }
        }
    }

    public <T> T withExclusiveAccess(String path, Supplier<T> fn) {
        return withExclusiveAccess(path, defaultTtl, defaultMaxWait, fn);
    }

    public VersionStamp readVersion(String path) {
        return store.getMetadata(path)
                .map(m -> new VersionStamp(path, m.eTag()))
                .orElseGet(() -> VersionStamp.absent(path));
    }

    /**
     * Replaces the object at {@code path} with {@code mutateFn(currentBytes)} if its version
     * still equals {@code expected}. {@code mutateFn} receives null when the object is absent
     * and is not invoked when the version already differs.
     *
     * @return the version written
     * @throws VersionConflictException when the object changed since {@code expected} was read
     */
    public VersionStamp compareAndSwap(String path, VersionStamp expected, UnaryOperator<byte[]> mutateFn) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(mutateFn, "mutateFn");
        if (!path.equals(expected.path())) {
            throw new IllegalArgumentException("Stamp for " + expected.path() + " used on " + path);
        }
        claim(path, ConcurrencyMode.OPTIMISTIC, Duration.ZERO);

        VersionStamp current = readVersion(path);
        if (!current.equals(expected)) {
            throw new VersionConflictException(expected, current);
        }

        byte[] currentBytes;
        try {
            currentBytes = expected.isAbsent() ? null : store.get(path);
        } catch (ObjectStoreException e) {
            if (e.statusCode() == 404) {
                throw new VersionConflictException(expected, VersionStamp.absent(path));
            }
            throw e;
        }

        byte[] next = Objects.requireNonNull(mutateFn.apply(currentBytes), "mutateFn result");
        try {
            ObjectStoreModels.ObjectDescriptor written = store.putConditional(path, next, expected.version());
            return new VersionStamp(path, written.eTag());
        } catch (ObjectStoreException e) {
            if (e.preconditionFailed()) {
                throw new VersionConflictException(expected, e);
            }
            throw e;
        }
    }

    /** Mode a path is guarded by, or null if it has not been used within the retention. */
    public ConcurrencyMode modeOf(String path) {
        ModeClaim claim = modes.get(path);
        return claim == null || claim.expiredAt(clock.instant()) ? null : claim.mode();
    }

    /** Number of paths whose mode is currently remembered. */
    int trackedPaths() {
        return modes.size();
    }

    private void claim(String path, ConcurrencyMode mode, Duration hold) {
        Instant now = clock.instant();
        Instant until = now.plus(hold.compareTo(modeRetention) > 0 ? hold : modeRetention);
        modes.compute(path, (p, prior) -> {
            if (prior == null || prior.expiredAt(now)) {
                return new ModeClaim(mode, until);
            }
            if (prior.mode() != mode) {
                throw new ConcurrencyPolicyViolationException(p, prior.mode(), mode);
            }
            return prior.until().isAfter(until) ? prior : new ModeClaim(mode, until);
        });
        sweepExpired(now);
    }

    private void sweepExpired(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(modeRetention))) {
            return;
        }
        int before = modes.size();
        modes.values().removeIf(c -> c.expiredAt(now));
        logger.debug("Forgot the mode of {} idle path(s)", before - modes.size());
    }

    private record ModeClaim(ConcurrencyMode mode, Instant until) {
        boolean expiredAt(Instant now) {
            return !until.isAfter(now);
        }
    }
}
