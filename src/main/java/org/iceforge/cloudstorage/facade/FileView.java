package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;

import java.time.Instant;
import java.util.Set;

/**
 * Cached metadata view of a stored file.
 */
public record FileView(String path, FileMetadata metadata, long size, String eTag, Instant lastModified) {

    public Set<String> tags() {
        return metadata.tags();
    }

    static FileView of(FinalObjectDescriptor descriptor, FileMetadata metadata, Instant at) {
        return new FileView(descriptor.path(), metadata, descriptor.size(), descriptor.eTag(), at);
    }

    static FileView of(ObjectStoreModels.ObjectMetadata object) {
        return new FileView(object.path(),
                FileMetadata.fromUserMetadata(object.userMetadata(), object.contentType()),
                object.size(), object.eTag(), object.lastModified());
    }
}
