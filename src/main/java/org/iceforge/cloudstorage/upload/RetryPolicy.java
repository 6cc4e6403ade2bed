package org.iceforge.cloudstorage.upload;

/**
 * Bounded attempts with exponential backoff for transient store failures.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMillis, long maxBackoffMillis) {

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (baseBackoffMillis < 0 || maxBackoffMillis < baseBackoffMillis) {
            throw new IllegalArgumentException("require 0 <= baseBackoffMillis <= maxBackoffMillis");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 500L, 30_000L);
    }

    /** Delay before attempt {@code attempt + 1}, given that {@code attempt} (1-based) just failed. */
    public long backoffMillis(int attempt) {
        int shift = Math.min(30, Math.max(0, attempt - 1));
        return Math.min(maxBackoffMillis, baseBackoffMillis * (1L << shift));
    }

    public void sleepBeforeRetry(int attempt) throws InterruptedException {
        long delay = backoffMillis(attempt);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }
}
