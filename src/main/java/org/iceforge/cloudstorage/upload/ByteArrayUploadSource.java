package org.iceforge.cloudstorage.upload;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

final class ByteArrayUploadSource implements UploadSource {
    private final byte[] bytes;

    ByteArrayUploadSource(byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes);
    }

    @Override
    public long size() {
        return bytes.length;
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IOException("Range [" + offset + ", " + (offset + length) + ") outside source of " + bytes.length + " bytes");
        }
        return Arrays.copyOfRange(bytes, (int) offset, (int) offset + length);
    }

    @Override
    public boolean randomAccess() {
        return true;
    }

    @Override
    public void close() {
    }
}
