package org.iceforge.cloudstorage.upload;

public enum UploadState {
    INITIALIZING,
    UPLOADING,
    COMPLETING,
    COMPLETED,
    ABORTING,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
