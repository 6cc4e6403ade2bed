package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.StorageException;

public class PartUploadException extends StorageException {
    private final int sequenceNumber;
    private final int attempts;

    public PartUploadException(String targetPath, int sequenceNumber, int attempts, Throwable cause) {
        super("Part " + sequenceNumber + " of " + targetPath + " failed after " + attempts + " attempt(s)", cause);
        this.sequenceNumber = sequenceNumber;
        this.attempts = attempts;
    }

    public int sequenceNumber() { return sequenceNumber; }
    public int attempts() { return attempts; }
}
