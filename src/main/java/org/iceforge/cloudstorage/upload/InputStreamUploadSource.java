package org.iceforge.cloudstorage.upload;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Forward-only source over a stream. Ranges must be requested in ascending offset order;
 * gaps are skipped, rewinds are rejected.
 */
final class InputStreamUploadSource implements UploadSource {
    private final InputStream in;
    private final long size;
    private long position;

    InputStreamUploadSource(InputStream in, long size) {
        this.in = Objects.requireNonNull(in);
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.size = size;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public synchronized byte[] read(long offset, int length) throws IOException {
        if (offset < position) {
            throw new IOException("Stream source cannot rewind from " + position + " to " + offset);
        }
        while (position < offset) {
            long skipped = in.skip(offset - position);
            if (skipped <= 0) {
                throw new EOFException("Stream ended at " + position + " while skipping to " + offset);
            }
            position += skipped;
        }
        byte[] out = readExactly(in, length);
        position += length;
        return out;
    }

    @Override
    public boolean randomAccess() {
        return false;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private byte[] readExactly(InputStream in, int target) throws IOException {
        byte[] out = new byte[target];
        int off = 0;
        while (off < target) {
            int r = in.read(out, off, target - off);
            if (r == -1) {
                throw new EOFException("Stream ended at " + (position + off) + ", expected " + (position + target));
            }
            off += r;
        }
        return out;
    }
}
