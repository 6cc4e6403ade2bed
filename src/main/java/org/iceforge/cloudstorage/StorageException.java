package org.iceforge.cloudstorage;

/**
 * Root of the engine's error taxonomy. All subclasses are unchecked.
 */
public abstract class StorageException extends RuntimeException {
    protected StorageException(String message) { super(message); }
    protected StorageException(String message, Throwable cause) { super(message, cause); }
}
