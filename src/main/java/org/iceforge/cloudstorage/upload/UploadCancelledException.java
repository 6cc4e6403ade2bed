package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

public class UploadCancelledException extends StorageException {
    public UploadCancelledException(String targetPath) {
        super("Upload cancelled: " + targetPath);
    }
}
