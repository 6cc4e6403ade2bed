package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.lock.VersionStamp;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;

/**
 * Persistence collaborator told about every completed upload, while the path's lock is still held.
 */
public interface FileRecordSink {

    void onUploaded(FileMetadata metadata, FinalObjectDescriptor descriptor, VersionStamp version);
}
