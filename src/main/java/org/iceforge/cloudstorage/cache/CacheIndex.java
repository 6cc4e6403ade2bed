package org.iceforge.cloudstorage.cache;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.event.StorageEvent;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tag-indexed, TTL-bound in-memory cache with single-flight population.
 * <p>
 * Entries and the tag index are guarded by one read/write lock, so {@link #invalidateTag}
 * is atomic with respect to {@link #put} and {@link #get}. Populations run outside the lock;
 * a result is stored only if none of its tags were invalidated, and the key was not written,
 * while it was being computed. Such a result is still handed to its callers.
 */
@Service
public class CacheIndex implements CacheMetrics {
    private static final Logger logger = LoggerFactory.getLogger(CacheIndex.class);

    private final Clock clock;
    private final Duration computeTimeout;
    private final StorageEventPublisher events;

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Map<String, Set<String>> keysByTag = new HashMap<>();
    // tag -> stamp of its last invalidation; only kept while an older population is running
    private final Map<String, Long> invalidatedAt = new HashMap<>();

    private final AtomicLong stamps = new AtomicLong();
    // start stamps of running populations
    private final ConcurrentSkipListSet<Long> populating = new ConcurrentSkipListSet<>();
    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    @Autowired
    public CacheIndex(CloudStorageProperties props, StorageEventPublisher events) {
        this(props.getCache().getComputeTimeout(), Clock.systemUTC(), events);
    }

    public CacheIndex(Duration computeTimeout, Clock clock, StorageEventPublisher events) {
        if (computeTimeout == null || computeTimeout.isNegative() || computeTimeout.isZero()) {
            throw new IllegalArgumentException("computeTimeout must be positive");
        }
        this.computeTimeout = computeTimeout;
        this.clock = Objects.requireNonNull(clock);
        this.events = Objects.requireNonNull(events);
    }

    public void put(String key, Object value, Set<String> tags, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Instant expiresAt = expiryFor(ttl);

        rw.writeLock().lock();
        try {
            store(new CacheEntry(key, value, tags, expiresAt, stamps.incrementAndGet()));
        } finally {
            rw.writeLock().unlock();
        }
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> found = lookup(key);
        if (found.isPresent()) {
            hits.increment();
            events.publish(StorageEvent.Type.CACHE_HIT, key);
        } else {
            misses.increment();
            events.publish(StorageEvent.Type.CACHE_MISS, key);
        }
        return found.map(type::cast);
    }

    /**
     * Returns the cached value for {@code key}, or computes, stores and returns it. Concurrent
     * callers for the same key share one computation and its outcome.
     *
     * @throws CacheComputeException if the computation fails, or does not finish within the
     *                               compute timeout for a waiting caller
     */
    public <T> T getOrCompute(String key, Set<String> tags, Duration ttl, Class<T> type, Supplier<? extends T> computeFn) {
        Set<String> fixed = Set.copyOf(tags);
        return getOrCompute(key, value -> fixed, ttl, type, computeFn);
    }

    /**
     * Variant whose tags are derived from the computed value.
     */
    public <T> T getOrCompute(String key, Function<? super T, Set<String>> tagsFn, Duration ttl, Class<T> type,
                              Supplier<? extends T> computeFn) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(tagsFn, "tagsFn");
        Objects.requireNonNull(computeFn, "computeFn");
        expiryFor(ttl);

        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            return type.cast(await(key, running));
        }
        try {
            return type.cast(populate(key, tagsFn, ttl, type, computeFn, mine));
        } finally {
            inFlight.remove(key, mine);
            if (!mine.isDone()) {
                mine.completeExceptionally(new CacheComputeException(key, "population abandoned"));
            }
        }
    }

    /**
     * Removes every entry carrying {@code tag}, along with those entries' other tag memberships.
     *
     * @return number of entries removed
     */
    public int invalidateTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        rw.writeLock().lock();
        try {
            long stamp = stamps.incrementAndGet();
            if (!populating.isEmpty()) {
                invalidatedAt.merge(tag, stamp, Math::max);
            }
            pruneInvalidations();

            Set<String> keys = keysByTag.remove(tag);
            if (keys == null) {
                return 0;
            }
            for (String key : keys) {
                CacheEntry removed = entries.remove(key);
                if (removed != null) {
                    unindex(removed);
                }
            }
            logger.debug("Invalidated tag {} ({} entries)", tag, keys.size());
            return keys.size();
        } finally {
            rw.writeLock().unlock();
        }
    }

    /** Keys currently indexed under {@code tag}. */
    public Set<String> keysFor(String tag) {
        rw.readLock().lock();
        try {
            Set<String> keys = keysByTag.get(tag);
            return keys == null ? Set.of() : Set.copyOf(keys);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public long hits() {
        return hits.sum();
    }

    @Override
    public long misses() {
        return misses.sum();
    }

    @Override
    public int entries() {
        rw.readLock().lock();
        try {
            return entries.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    private <T> Object populate(String key, Function<? super T, Set<String>> tagsFn, Duration ttl, Class<T> type,
                                Supplier<? extends T> computeFn, CompletableFuture<Object> mine) {
        long startedAt;
        // registered under the lock so no invalidation falls between stamp and registration
        rw.readLock().lock();
        try {
            startedAt = stamps.incrementAndGet();
            populating.add(startedAt);
        } finally {
            rw.readLock().unlock();
        }
        try {
            // a previous population may have stored the key between our miss and our claim
            Optional<Object> raced = lookup(key);
            if (raced.isPresent()) {
                mine.complete(raced.get());
                return raced.get();
            }

            T value;
            Set<String> tags;
            try {
                value = Objects.requireNonNull(computeFn.get(), "computed value");
                type.cast(value);
                tags = Set.copyOf(tagsFn.apply(value));
            } catch (RuntimeException | Error e) {
                CacheComputeException failure = new CacheComputeException(key, e);
                mine.completeExceptionally(failure);
                throw failure;
            }

            storeIfCurrent(key, value, tags, ttl, startedAt);
            mine.complete(value);
            return value;
        } finally {
            populating.remove(startedAt);
        }
    }

    private void storeIfCurrent(String key, Object value, Set<String> tags, Duration ttl, long startedAt) {
        rw.writeLock().lock();
        try {
            CacheEntry existing = entries.get(key);
            if (existing != null && existing.stamp() > startedAt) {
                logger.debug("Not caching {}: written concurrently", key);
                return;
            }
            for (String tag : tags) {
                Long invalidated = invalidatedAt.get(tag);
                if (invalidated != null && invalidated > startedAt) {
                    logger.debug("Not caching {}: tag {} invalidated during computation", key, tag);
                    return;
                }
            }
            store(new CacheEntry(key, value, tags, expiryFor(ttl), stamps.incrementAndGet()));
        } finally {
            populating.remove(startedAt);
            pruneInvalidations();
            rw.writeLock().unlock();
        }
    }

    /** Tags whose invalidation is still remembered for running populations. */
    int trackedInvalidations() {
        rw.readLock().lock();
        try {
            return invalidatedAt.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    // callers hold the write lock; drops invalidations no running population started before
    private void pruneInvalidations() {
        if (invalidatedAt.isEmpty()) {
            return;
        }
        Long oldest = populating.ceiling(Long.MIN_VALUE);
        if (oldest == null) {
            invalidatedAt.clear();
        } else {
            invalidatedAt.values().removeIf(stamp -> stamp <= oldest);
        }
    }

    private Object await(String key, CompletableFuture<Object> running) {
        try {
            return running.get(computeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CacheComputeException shared) {
                throw shared;
            }
            throw new CacheComputeException(key, e.getCause());
        } catch (TimeoutException e) {
            throw new CacheComputeException(key, "timed out after " + computeTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheComputeException(key, "interrupted while waiting");
        }
    }

    private Optional<Object> lookup(String key) {
        Instant now = clock.instant();
        rw.readLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isExpired(now)) {
                return Optional.of(entry.value());
            }
        } finally {
            rw.readLock().unlock();
        }

        rw.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isExpired(now)) {
                return Optional.of(entry.value());
            }
            entries.remove(key);
            unindex(entry);
            return Optional.empty();
        } finally {
            rw.writeLock().unlock();
        }
    }

    // callers hold the write lock
    private void store(CacheEntry entry) {
        CacheEntry previous = entries.put(entry.key(), entry);
        if (previous != null) {
            unindex(previous);
        }
        for (String tag : entry.tags()) {
            keysByTag.computeIfAbsent(tag, t -> new HashSet<>()).add(entry.key());
        }
    }

    private void unindex(CacheEntry entry) {
        for (String tag : entry.tags()) {
            Set<String> keys = keysByTag.get(tag);
            if (keys != null) {
                keys.remove(entry.key());
                if (keys.isEmpty()) {
                    keysByTag.remove(tag);
                }
            }
        }
    }

    private Instant expiryFor(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return clock.instant().plus(ttl);
    }
}
