package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.event.StorageEvent;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives {@link UploadSession}s through
 * {@code INITIALIZING -> UPLOADING -> COMPLETING -> COMPLETED}, with
 * {@code UPLOADING -> ABORTING -> ABORTED} and {@code -> FAILED} on unrecoverable errors.
 * <p>
 * Parts may be uploaded concurrently and in any order; the store orders them by sequence
 * number on completion. Completion is refused until every part is committed.
 */
@Service
public class MultipartUploadCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(MultipartUploadCoordinator.class);

    private final ObjectStoreClient store;
    private final ChunkPlanner planner;
    private final RetryPolicy retryPolicy;
    private final StorageEventPublisher events;

    public MultipartUploadCoordinator(ObjectStoreClient store, ChunkPlanner planner, RetryPolicy retryPolicy,
                                      StorageEventPublisher events) {
        this.store = Objects.requireNonNull(store);
        this.planner = Objects.requireNonNull(planner);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.events = Objects.requireNonNull(events);
    }

    public UploadSession startUpload(UploadSource source, String targetPath, long chunkSize) {
        return startUpload(source, targetPath, chunkSize, null, Map.of(), CancellationSignal.none());
    }

    public UploadSession startUpload(UploadSource source, String targetPath, long chunkSize, String contentType,
                                     Map<String, String> userMetadata, CancellationSignal cancellation) {
        List<PartRange> plan = planner.plan(source.size(), chunkSize);
        UploadSession session = new UploadSession(targetPath, source, chunkSize, plan, cancellation);

        try {
            session.begin(store.initiateMultipart(targetPath, contentType, userMetadata));
        } catch (ObjectStoreException e) {
            session.fail();
            releaseSource(session);
            throw new InitiationException(targetPath, e);
        }
        logger.debug("Started multipart upload of {} ({} bytes, {} parts)", targetPath, session.totalSize(), plan.size());
        return session;
    }

    /**
     * Reads the part's bytes from the session source. For forward-only sources, parts must be
     * read in ascending order.
     */
    public byte[] readPart(UploadSession session, PartRange part) {
        try {
            return session.source().read(part.byteOffset(), Math.toIntExact(part.byteLength()));
        } catch (IOException | ArithmeticException e) {
            logger.error("Failed to read part {} of {}", part.sequenceNumber(), session.targetPath(), e);
            session.markPartFailed(part.sequenceNumber());
            publishPartFailed(session, part, 0, e);
            throw new PartUploadException(session.targetPath(), part.sequenceNumber(), 0, e);
        }
    }

    public void uploadPart(UploadSession session, PartRange part) {
        if (session.part(part.sequenceNumber()).status() == PartStatus.COMMITTED) {
            return;
        }
        uploadPart(session, part, readPart(session, part));
    }

    /**
     * Submits an already-read part, retrying transient store failures with exponential backoff.
     * A committed part is not resent.
     */
    public void uploadPart(UploadSession session, PartRange part, byte[] payload) {
        int seq = part.sequenceNumber();
        if (payload.length != part.byteLength()) {
            throw new IllegalArgumentException("Part " + seq + " expects " + part.byteLength() + " bytes, got " + payload.length);
        }
        if (session.part(seq).status() == PartStatus.COMMITTED) {
            return;
        }

        int attempt = 0;
        while (true) {
            if (session.cancellation().isCancelled()) {
                throw new UploadCancelledException(session.targetPath());
            }
            session.markInFlight(seq);
            attempt++;
            try {
                String eTag = store.uploadPart(session.sessionId(), seq, payload);
                session.markCommitted(seq, eTag);
                return;
            } catch (ObjectStoreException e) {
                if (!e.retryable() || attempt >= retryPolicy.maxAttempts()) {
                    failPart(session, part, attempt, e);
                }
                events.publish(StorageEvent.Type.PART_RETRIED, session.targetPath(),
                        Map.of("part", seq, "attempt", attempt, "status", e.statusCode()));
                logger.debug("Retrying part {} of {} after attempt {}: {}", seq, session.targetPath(), attempt, e.getMessage());
                try {
                    retryPolicy.sleepBeforeRetry(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    session.markPartFailed(seq);
                    throw new UploadCancelledException(session.targetPath());
                }
            }
        }
    }

    public FinalObjectDescriptor completeUpload(UploadSession session) {
        if (session.cancellation().isCancelled()) {
            throw new UploadCancelledException(session.targetPath());
        }
        List<ObjectStoreModels.CompletedPart> parts = session.beginCompletion();

        ObjectStoreModels.ObjectDescriptor done;
        try {
            done = store.completeMultipart(session.sessionId(), parts);
        } catch (ObjectStoreException e) {
            session.fail();
            logger.error("Store rejected completion of {}", session.targetPath(), e);
            throw new CompletionException(session.targetPath(), e);
        }
        session.completed();
        releaseSource(session);

        FinalObjectDescriptor descriptor = new FinalObjectDescriptor(
                session.targetPath(), done.eTag(), done.versionId(), session.totalSize(), parts.size());
        events.publish(StorageEvent.Type.UPLOAD_COMPLETED, session.targetPath(),
                Map.of("bytes", session.totalSize(), "parts", parts.size()));
        return descriptor;
    }

    /**
     * Discards the upload's parts in the store. Safe to call repeatedly and from any
     * non-completed state, including FAILED.
     */
    public void abortUpload(UploadSession session) {
        if (!session.beginAbort()) {
            releaseSource(session);
            return;
        }

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                store.abortMultipart(session.sessionId());
                break;
            } catch (ObjectStoreException e) {
                if (!e.retryable() || attempt >= retryPolicy.maxAttempts()) {
                    session.abortFailed();
                    logger.error("Failed to abort multipart upload of {} after {} attempt(s)", session.targetPath(), attempt, e);
                    throw e;
                }
                try {
                    retryPolicy.sleepBeforeRetry(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    session.abortFailed();
                    throw e;
                }
            }
        }

        session.aborted();
        releaseSource(session);
        events.publish(StorageEvent.Type.UPLOAD_ABORTED, session.targetPath(), Map.of("state", session.state().name()));
    }

    private void failPart(UploadSession session, PartRange part, int attempts, ObjectStoreException cause) {
        session.markPartFailed(part.sequenceNumber());
        publishPartFailed(session, part, attempts, cause);
        logger.warn("Part {} of {} failed after {} attempt(s): {}",
                part.sequenceNumber(), session.targetPath(), attempts, cause.getMessage());
        throw new PartUploadException(session.targetPath(), part.sequenceNumber(), attempts, cause);
    }

    private void publishPartFailed(UploadSession session, PartRange part, int attempts, Exception cause) {
        events.publish(StorageEvent.Type.PART_FAILED, session.targetPath(),
                Map.of("part", part.sequenceNumber(), "attempts", attempts, "error", String.valueOf(cause.getMessage())));
    }

    private void releaseSource(UploadSession session) {
        try {
            session.source().close();
        } catch (IOException e) {
            logger.warn("Failed to close upload source of {}: {}", session.targetPath(), e.toString());
        }
    }
}
