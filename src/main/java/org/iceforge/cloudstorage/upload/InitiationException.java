package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

/**
 * The store refused to start a multipart upload (invalid key, quota exceeded, ...).
 */
public class InitiationException extends StorageException {
    private final String targetPath;

    public InitiationException(String targetPath, Throwable cause) {
        super("Failed to initiate multipart upload for " + targetPath, cause);
        this.targetPath = targetPath;
    }

    public String targetPath() { return targetPath; }
}
