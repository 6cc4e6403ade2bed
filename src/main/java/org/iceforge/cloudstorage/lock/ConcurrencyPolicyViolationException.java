package org.iceforge.cloudstorage.lock;

import org.iceforge.cloudstorage.StorageException;

/**
 * A path already guarded one way (exclusive locks or compare-and-swap) was used the other way.
 */
public class ConcurrencyPolicyViolationException extends StorageException {

    public ConcurrencyPolicyViolationException(String path, ConcurrencyMode established, ConcurrencyMode attempted) {
        super("Path " + path + " is guarded by " + established + " access; " + attempted + " access is not allowed");
    }
}
