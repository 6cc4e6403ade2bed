package org.iceforge.cloudstorage.upload;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an object of {@code totalSize} bytes into ordered, contiguous parts.
 * <p>
 * Stateless and deterministic: the same inputs always produce the same plan.
 */
public class ChunkPlanner {

    private final long minPartSize;
    private final int maxParts;

    public ChunkPlanner(long minPartSize, int maxParts) {
        if (minPartSize <= 0) {
            throw new IllegalArgumentException("minPartSize must be > 0");
        }
        if (maxParts <= 0) {
            throw new IllegalArgumentException("maxParts must be > 0");
        }
        this.minPartSize = minPartSize;
        this.maxParts = maxParts;
    }

    public long minPartSize() {
        return minPartSize;
    }

    public int maxParts() {
        return maxParts;
    }

    public List<PartRange> plan(long totalSize, long chunkSize) {
        if (chunkSize <= 0) {
            throw new InvalidChunkSizeException("chunkSize must be > 0, was " + chunkSize);
        }
        if (totalSize <= 0) {
            throw new InvalidChunkSizeException("totalSize must be > 0, was " + totalSize);
        }

        long partCount = partCount(totalSize, chunkSize);
        // only the last part may be smaller than the provider minimum
        if (partCount > 1 && chunkSize < minPartSize) {
            throw new InvalidChunkSizeException(
                    "chunkSize (" + chunkSize + ") is below the minimum part size (" + minPartSize + ")");
        }
        if (partCount > maxParts) {
            throw new InvalidChunkSizeException(
                    "chunkSize (" + chunkSize + ") yields " + partCount + " parts, more than the maximum " + maxParts);
        }

        List<PartRange> parts = new ArrayList<>((int) partCount);
        long offset = 0;
        int seq = 1;
        while (offset < totalSize) {
            long length = Math.min(chunkSize, totalSize - offset);
            parts.add(new PartRange(seq++, offset, length));
            offset += length;
        }
        return List.copyOf(parts);
    }

    public static long partCount(long totalSize, long chunkSize) {
        return totalSize / chunkSize + (totalSize % chunkSize == 0 ? 0 : 1);
    }
}
