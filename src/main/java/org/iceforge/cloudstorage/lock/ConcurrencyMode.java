package org.iceforge.cloudstorage.lock;

public enum ConcurrencyMode {
    /** guarded by {@link LockManager#withExclusiveAccess} */
    EXCLUSIVE,
    /** guarded by {@link LockManager#compareAndSwap} */
    OPTIMISTIC
}
