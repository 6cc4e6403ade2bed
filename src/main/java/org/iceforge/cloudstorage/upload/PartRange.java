package org.iceforge.cloudstorage.upload;

/**
 * One planned part: bytes {@code [byteOffset, byteOffset + byteLength)} uploaded under
 * {@code sequenceNumber} (1-based).
 */
public record PartRange(int sequenceNumber, long byteOffset, long byteLength) {

    public long endOffset() {
        return byteOffset + byteLength;
    }
}
