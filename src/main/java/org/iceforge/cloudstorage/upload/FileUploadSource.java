package org.iceforge.cloudstorage.upload;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Positional reads over a file; safe for concurrent part reads.
 */
final class FileUploadSource implements UploadSource {
    private final FileChannel channel;
    private final long size;

    FileUploadSource(Path file) throws IOException {
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.size = channel.size();
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length);
        long position = offset;
        while (buf.hasRemaining()) {
            int r = channel.read(buf, position);
            if (r == -1) {
                throw new EOFException("File ended at " + position + ", expected " + (offset + length));
            }
            position += r;
        }
        return buf.array();
    }

    @Override
    public boolean randomAccess() {
        return true;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
