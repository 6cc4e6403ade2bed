package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.event.StorageEvent;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;
import org.iceforge.cloudstorage.upload.PartUploadException;
import org.iceforge.cloudstorage.upload.RetryPolicy;
import org.iceforge.cloudstorage.upload.UploadCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Small objects: one PUT, retried on transient failures like a single part.
 */
@Service
public class DirectUploadStrategy implements UploadStrategy {
    private static final Logger logger = LoggerFactory.getLogger(DirectUploadStrategy.class);

    private final ObjectStoreClient store;
    private final RetryPolicy retryPolicy;
    private final StorageEventPublisher events;

    public DirectUploadStrategy(ObjectStoreClient store, RetryPolicy retryPolicy, StorageEventPublisher events) {
        this.store = Objects.requireNonNull(store);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.events = Objects.requireNonNull(events);
    }

    @Override
    public Kind kind() {
        return Kind.DIRECT;
    }

    @Override
    public FinalObjectDescriptor upload(UploadRequest request) {
        byte[] bytes;
        try (var source = request.source()) {
            bytes = source.read(0, Math.toIntExact(source.size()));
        } catch (IOException | ArithmeticException e) {
            throw new PartUploadException(request.path(), 1, 0, e);
        }

        int attempt = 0;
        while (true) {
            if (request.cancellation().isCancelled()) {
                throw new UploadCancelledException(request.path());
            }
            attempt++;
            try {
                ObjectStoreModels.ObjectDescriptor done =
                        store.putSingle(request.path(), bytes, request.contentType(), request.userMetadata());
                events.publish(StorageEvent.Type.UPLOAD_COMPLETED, request.path(), Map.of("bytes", bytes.length, "parts", 1));
                return new FinalObjectDescriptor(request.path(), done.eTag(), done.versionId(), bytes.length, 1);
            } catch (ObjectStoreException e) {
                if (!e.retryable() || attempt >= retryPolicy.maxAttempts()) {
                    events.publish(StorageEvent.Type.PART_FAILED, request.path(),
                            Map.of("part", 1, "attempts", attempt, "error", String.valueOf(e.getMessage())));
                    throw new PartUploadException(request.path(), 1, attempt, e);
                }
                logger.debug("Retrying direct upload of {} after attempt {}: {}", request.path(), attempt, e.getMessage());
                try {
                    retryPolicy.sleepBeforeRetry(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new UploadCancelledException(request.path());
                }
            }
        }
    }
}
