package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;
import org.iceforge.cloudstorage.upload.MultipartUploadCoordinator;
import org.iceforge.cloudstorage.upload.UploadSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Template for strategies backed by {@link MultipartUploadCoordinator}: start, upload every
 * part, complete. Any failure after the store issued an upload id aborts the upload before
 * the error propagates.
 */
public abstract class CoordinatedUploadStrategy implements UploadStrategy {
    private static final Logger logger = LoggerFactory.getLogger(CoordinatedUploadStrategy.class);

    protected final MultipartUploadCoordinator coordinator;

    protected CoordinatedUploadStrategy(MultipartUploadCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator);
    }

    @Override
    public final FinalObjectDescriptor upload(UploadRequest request) {
        UploadSession session = coordinator.startUpload(request.source(), request.path(), request.chunkSize(),
                request.contentType(), request.userMetadata(), request.cancellation());
        try {
            uploadParts(session);
            return coordinator.completeUpload(session);
        } catch (RuntimeException e) {
            abortAfterFailure(session, e);
            throw e;
        }
    }

    /**
     * Uploads every planned part of {@code session}, or throws.
     */
    protected abstract void uploadParts(UploadSession session);

    private void abortAfterFailure(UploadSession session, RuntimeException failure) {
        try {
            coordinator.abortUpload(session);
        } catch (RuntimeException abortError) {
            logger.error("Abort after failed upload of {} also failed; parts may be orphaned", session.targetPath(), abortError);
            failure.addSuppressed(abortError);
        }
    }
}
