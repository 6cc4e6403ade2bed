package org.iceforge.cloudstorage.upload;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Bytes of the object being uploaded. Reads return exactly the requested range or fail.
 */
public interface UploadSource extends Closeable {

    long size();

    byte[] read(long offset, int length) throws IOException;

    /** Whether {@link #read} may be called for ranges in any order. */
    boolean randomAccess();

    static UploadSource of(InputStream in, long size) {
        return new InputStreamUploadSource(in, size);
    }

    static UploadSource of(byte[] bytes) {
        return new ByteArrayUploadSource(bytes);
    }

    static UploadSource of(Path file) throws IOException {
        return new FileUploadSource(file);
    }
}
