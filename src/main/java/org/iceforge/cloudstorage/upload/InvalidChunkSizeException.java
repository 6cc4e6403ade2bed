package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

public class InvalidChunkSizeException extends StorageException {
    public InvalidChunkSizeException(String message) { super(message); }
}
