package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

import java.util.List;

public class IncompletePartsException extends StorageException {
    private final List<Integer> incomplete;

    public IncompletePartsException(String targetPath, List<Integer> incomplete) {
        super("Cannot complete " + targetPath + ": parts not committed " + incomplete);
        this.incomplete = List.copyOf(incomplete);
    }

    public List<Integer> incompleteParts() { return incomplete; }
}
