package org.iceforge.cloudstorage.upload;

public enum PartStatus {
    PENDING,
    IN_FLIGHT,
    COMMITTED,
    FAILED
}
