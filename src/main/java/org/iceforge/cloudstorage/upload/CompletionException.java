package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

public class CompletionException extends StorageException {
    public CompletionException(String targetPath, Throwable cause) {
        super("Store rejected completion of " + targetPath, cause);
    }
}
