package org.iceforge.cloudstorage;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the storage orchestration engine.
 * <p>
 * Defaults are intentionally small and safe for local dev.
 */
@ConfigurationProperties(prefix = "cloudstorage")
public class CloudStorageProperties {

    /** Backend selector: "s3" (default) or "local". */
    private String store = "s3";

    /** Bucket holding user objects, lock objects and quota counters. */
    private String bucket = "cloudstorage";

    /** Root directory used when {@code store=local}. */
    private String localBaseDir = "./.cloudstorage";

    private final Upload upload = new Upload();
    private final Cache cache = new Cache();
    private final Lock lock = new Lock();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getLocalBaseDir() {
        return localBaseDir;
    }

    public void setLocalBaseDir(String localBaseDir) {
        this.localBaseDir = localBaseDir;
    }

    public Upload getUpload() {
        return upload;
    }

    public Cache getCache() {
        return cache;
    }

    public Lock getLock() {
        return lock;
    }

    public static class Upload {

        /** Size of every part except the last. */
        private long chunkSizeBytes = 8L * 1024 * 1024;

        /** Provider-imposed minimum for every part except the last. */
        private long minPartSizeBytes = 5L * 1024 * 1024;

        /** Provider-imposed maximum number of parts per upload. */
        private int maxParts = 10_000;

        /** Objects up to this size are written with a single PUT. */
        private long directMaxBytes = 5L * 1024 * 1024;

        /** Objects from this size on have their parts uploaded concurrently. */
        private long chunkedAboveBytes = 128L * 1024 * 1024;

        /** Attempts per part (and per abort) before giving up. */
        private int maxAttempts = 3;

        private long retryBaseBackoffMillis = 500L;

        private long retryMaxBackoffMillis = 30_000L;

        /** Worker threads for concurrent part uploads. */
        private int uploadThreads = 4;

        /** Worker threads running whole uploads submitted with uploadAsync. */
        private int asyncUploadThreads = 2;

        /** Parts read into memory but not yet acknowledged by the store, per upload. */
        private int maxInFlightParts = 4;

        public long getChunkSizeBytes() {
            return chunkSizeBytes;
        }

        public void setChunkSizeBytes(long chunkSizeBytes) {
            this.chunkSizeBytes = chunkSizeBytes;
        }

        public long getMinPartSizeBytes() {
            return minPartSizeBytes;
        }

        public void setMinPartSizeBytes(long minPartSizeBytes) {
            this.minPartSizeBytes = minPartSizeBytes;
        }

        public int getMaxParts() {
            return maxParts;
        }

        public void setMaxParts(int maxParts) {
            this.maxParts = maxParts;
        }

        public long getDirectMaxBytes() {
            return directMaxBytes;
        }

        public void setDirectMaxBytes(long directMaxBytes) {
            this.directMaxBytes = directMaxBytes;
        }

        public long getChunkedAboveBytes() {
            return chunkedAboveBytes;
        }

        public void setChunkedAboveBytes(long chunkedAboveBytes) {
            this.chunkedAboveBytes = chunkedAboveBytes;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseBackoffMillis() {
            return retryBaseBackoffMillis;
        }

        public void setRetryBaseBackoffMillis(long retryBaseBackoffMillis) {
            this.retryBaseBackoffMillis = retryBaseBackoffMillis;
        }

        public long getRetryMaxBackoffMillis() {
            return retryMaxBackoffMillis;
        }

        public void setRetryMaxBackoffMillis(long retryMaxBackoffMillis) {
            this.retryMaxBackoffMillis = retryMaxBackoffMillis;
        }

        public int getUploadThreads() {
            return uploadThreads;
        }

        public void setUploadThreads(int uploadThreads) {
            this.uploadThreads = uploadThreads;
        }

        public int getAsyncUploadThreads() {
            return asyncUploadThreads;
        }

        public void setAsyncUploadThreads(int asyncUploadThreads) {
            this.asyncUploadThreads = asyncUploadThreads;
        }

        public int getMaxInFlightParts() {
            return maxInFlightParts;
        }

        public void setMaxInFlightParts(int maxInFlightParts) {
            this.maxInFlightParts = maxInFlightParts;
        }
    }

    public static class Cache {

        /** TTL for file metadata and quota entries. */
        private Duration metadataTtl = Duration.ofMinutes(10);

        /** Upper bound a caller waits for another caller's computation of the same key. */
        private Duration computeTimeout = Duration.ofSeconds(30);

        public Duration getMetadataTtl() {
            return metadataTtl;
        }

        public void setMetadataTtl(Duration metadataTtl) {
            this.metadataTtl = metadataTtl;
        }

        public Duration getComputeTimeout() {
            return computeTimeout;
        }

        public void setComputeTimeout(Duration computeTimeout) {
            this.computeTimeout = computeTimeout;
        }
    }

    public static class Lock {

        /** Key prefix for lock objects in the bucket. */
        private String prefix = "_locks";

        private Duration ttl = Duration.ofMinutes(15);

        private Duration maxWait = Duration.ofSeconds(10);

        /** How long the lock/CAS mode of an idle path is remembered. */
        private Duration modeRetention = Duration.ofMinutes(15);

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getMaxWait() {
            return maxWait;
        }

        public void setMaxWait(Duration maxWait) {
            this.maxWait = maxWait;
        }

        public Duration getModeRetention() {
            return modeRetention;
        }

        public void setModeRetention(Duration modeRetention) {
            this.modeRetention = modeRetention;
        }
    }
}
