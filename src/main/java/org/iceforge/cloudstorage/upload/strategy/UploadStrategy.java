package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;

/**
 * One way of getting an object's bytes into the store. A strategy either returns the final
 * object or leaves nothing behind in the store.
 */
public interface UploadStrategy {

    enum Kind {
        /** single PUT */
        DIRECT,
        /** multipart, parts uploaded one after another */
        MULTIPART,
        /** multipart, parts uploaded concurrently */
        CHUNKED
    }

    Kind kind();

    FinalObjectDescriptor upload(UploadRequest request);
}
