package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.task.TaskSubmitter;
import org.iceforge.cloudstorage.upload.MultipartUploadCoordinator;
import org.iceforge.cloudstorage.upload.PartRange;
import org.iceforge.cloudstorage.upload.UploadCancelledException;
import org.iceforge.cloudstorage.upload.UploadSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Large objects: parts are read in order on the calling thread and uploaded concurrently.
 * <p>
 * Backpressure: at most {@code maxInFlightParts} part payloads are held in memory at once.
 * The first failure stops further reads; every submitted part is awaited before the error
 * propagates, so the abort that follows never races an in-flight part.
 */
@Service
public class ChunkedUploadStrategy extends CoordinatedUploadStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ChunkedUploadStrategy.class);

    private final TaskSubmitter submitter;
    private final int maxInFlightParts;

    @Autowired
    public ChunkedUploadStrategy(MultipartUploadCoordinator coordinator,
                                 @Qualifier("taskSubmitter") TaskSubmitter submitter,
                                 CloudStorageProperties props) {
        this(coordinator, submitter, props.getUpload().getMaxInFlightParts());
    }

    // used by non-spring tests
    public ChunkedUploadStrategy(MultipartUploadCoordinator coordinator, TaskSubmitter submitter, int maxInFlightParts) {
        super(coordinator);
        if (maxInFlightParts <= 0) {
            throw new IllegalArgumentException("maxInFlightParts must be > 0");
        }
        this.submitter = Objects.requireNonNull(submitter);
        this.maxInFlightParts = maxInFlightParts;
    }

    @Override
    public Kind kind() {
        return Kind.CHUNKED;
    }

    @Override
    protected void uploadParts(UploadSession session) {
        Semaphore inflightParts = new Semaphore(maxInFlightParts);
        AtomicReference<Throwable> firstError = new AtomicReference<>(null);
        List<Future<?>> pending = new ArrayList<>();

        try {
            for (PartRange part : session.plan()) {
                if (firstError.get() != null) {
                    break;
                }
                inflightParts.acquire();
                byte[] payload;
                try {
                    payload = coordinator.readPart(session, part);
                } catch (RuntimeException e) {
                    inflightParts.release();
                    throw e;
                }
                pending.add(submitter.submit(() -> {
                    try {
                        coordinator.uploadPart(session, part, payload);
                    } catch (Throwable t) {
                        firstError.compareAndSet(null, t);
                        throw t;
                    } finally {
                        inflightParts.release();
                    }
                    return null;
                }));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.cancellation().cancel();
            firstError.compareAndSet(null, new UploadCancelledException(session.targetPath()));
        } catch (RuntimeException e) {
            firstError.compareAndSet(null, e);
        } finally {
            awaitAll(session, pending, firstError);
        }

        Throwable err = firstError.get();
        if (err != null) {
            if (err instanceof RuntimeException re) {
                throw re;
            }
            if (err instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(err);
        }
    }

    private void awaitAll(UploadSession session, List<Future<?>> pending, AtomicReference<Throwable> firstError) {
        boolean interrupted = false;
        for (Future<?> f : pending) {
            while (true) {
                try {
                    f.get();
                    break;
                } catch (ExecutionException e) {
                    firstError.compareAndSet(null, e.getCause());
                    break;
                } catch (InterruptedException e) {
                    // keep waiting: the parts must settle before anyone aborts the upload
                    interrupted = true;
                    session.cancellation().cancel();
                    firstError.compareAndSet(null, new UploadCancelledException(session.targetPath()));
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Settled {} part upload(s) of {}", pending.size(), session.targetPath());
    }
}
