package org.iceforge.cloudstorage.lock;

import java.util.Objects;

/**
 * Version of the object at {@code path}: its store ETag, or null when the object does not exist.
 */
public record VersionStamp(String path, String version) {

    public VersionStamp {
        Objects.requireNonNull(path, "path");
    }

    public static VersionStamp absent(String path) {
        return new VersionStamp(path, null);
    }

    public boolean isAbsent() {
        return version == null;
    }
}
