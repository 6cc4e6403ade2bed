package org.iceforge.cloudstorage.lock;

import java.time.Duration;

/**
 * Backend for {@link LockManager}: a single atomic acquire-if-absent-or-expired against
 * shared state, so two concurrent acquirers can never both win the same path.
 */
public interface LockService {

    /**
     * @return true if {@code token} now holds the lock on {@code path} for {@code ttl}
     */
    boolean tryAcquire(String path, String token, Duration ttl);

    /**
     * Releases the lock on {@code path} only if {@code token} still holds it.
     *
     * @return true if a lock was removed
     */
    boolean release(String path, String token);
}
