package org.iceforge.cloudstorage.lock;

import org.iceforge.cloudstorage.StorageException;

/**
 * The object changed since the caller read its version. Callers re-read and retry.
 */
public class VersionConflictException extends StorageException {

    private final VersionStamp expected;
    private final VersionStamp actual;

    public VersionConflictException(VersionStamp expected, VersionStamp actual) {
        super("Version conflict on " + expected.path() + ": expected " + expected.version() + ", found "
                + (actual == null ? "<changed>" : actual.version()));
        this.expected = expected;
        this.actual = actual;
    }

    public VersionConflictException(VersionStamp expected, Throwable cause) {
        super("Version conflict on " + expected.path() + ": conditional write rejected", cause);
        this.expected = expected;
        this.actual = null;
    }

    public VersionStamp expected() {
        return expected;
    }

    /** Current stamp when known; null when the store rejected the write. */
    public VersionStamp actual() {
        return actual;
    }
}
