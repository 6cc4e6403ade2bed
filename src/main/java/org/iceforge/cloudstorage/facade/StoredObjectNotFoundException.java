package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.StorageException;

public class StoredObjectNotFoundException extends StorageException {

    private final String path;

    public StoredObjectNotFoundException(String path) {
        super("No object at " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
