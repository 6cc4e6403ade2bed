package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.upload.CancellationSignal;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to an upload running in the background.
 */
public final class UploadTicket {

    private final String path;
    private final Future<UploadResult> result;
    private final CancellationSignal cancellation;

    UploadTicket(String path, Future<UploadResult> result, CancellationSignal cancellation) {
        this.path = Objects.requireNonNull(path);
        this.result = Objects.requireNonNull(result);
        this.cancellation = Objects.requireNonNull(cancellation);
    }

    public String path() {
        return path;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Requests cancellation. An upload that already started stops before its next part and
     * discards what the store received; {@link #await} then fails with
     * {@link org.iceforge.cloudstorage.upload.UploadCancelledException}.
     *
     * @return false if the upload had already finished
     */
    public boolean cancel() {
        if (result.isDone()) {
            return false;
        }
        cancellation.cancel();
        return true;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Waits for the upload. Failures of the upload itself are rethrown unwrapped.
     */
    public UploadResult await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Upload of " + path + " failed", cause);
        }
    }
}
