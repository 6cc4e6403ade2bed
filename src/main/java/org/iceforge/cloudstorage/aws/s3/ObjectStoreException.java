package org.iceforge.cloudstorage.aws.s3;

/**
 * Failure reported by an {@link ObjectStoreClient}. {@code retryable} marks network errors,
 * timeouts, throttling and 5xx responses.
 */
public class ObjectStoreException extends RuntimeException {
    public static final int PRECONDITION_FAILED = 412;
    public static final int CONDITIONAL_REQUEST_CONFLICT = 409;

    private final int statusCode;
    private final boolean retryable;

    public ObjectStoreException(String message, Throwable cause, int statusCode, boolean retryable) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public ObjectStoreException(String message, int statusCode, boolean retryable) {
        this(message, null, statusCode, retryable);
    }

    public int statusCode() { return statusCode; }

    public boolean retryable() { return retryable; }

    public boolean preconditionFailed() {
        return statusCode == PRECONDITION_FAILED || statusCode == CONDITIONAL_REQUEST_CONFLICT;
    }
}
