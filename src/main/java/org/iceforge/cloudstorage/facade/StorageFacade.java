package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.cache.CacheComputeException;
import org.iceforge.cloudstorage.cache.CacheIndex;
import org.iceforge.cloudstorage.lock.LockManager;
import org.iceforge.cloudstorage.lock.VersionStamp;
import org.iceforge.cloudstorage.task.TaskSubmitter;
import org.iceforge.cloudstorage.upload.CancellationSignal;
import org.iceforge.cloudstorage.upload.ChunkPlanner;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;
import org.iceforge.cloudstorage.upload.UploadSource;
import org.iceforge.cloudstorage.upload.strategy.UploadRequest;
import org.iceforge.cloudstorage.upload.strategy.UploadStrategy;
import org.iceforge.cloudstorage.upload.strategy.UploadStrategySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Single entry point for callers: locked uploads, cached reads, tag invalidation and
 * versioned quota counters.
 */
@Service
public class StorageFacade {
    private static final Logger logger = LoggerFactory.getLogger(StorageFacade.class);

    static final String QUOTA_PREFIX = "_quota/";

    private final UploadStrategySelector strategies;
    private final CacheIndex cache;
    private final LockManager locks;
    private final ObjectStoreClient store;
    private final TaskSubmitter jobs;
    private final List<FileRecordSink> sinks;
    private final CloudStorageProperties props;
    private final Clock clock;

    @Autowired
    public StorageFacade(UploadStrategySelector strategies,
                         CacheIndex cache,
                         LockManager locks,
                         ObjectStoreClient store,
                         @Qualifier("uploadJobSubmitter") TaskSubmitter jobs,
                         ObjectProvider<FileRecordSink> sinks,
                         CloudStorageProperties props) {
        this(strategies, cache, locks, store, jobs, sinks.orderedStream().toList(), props, Clock.systemUTC());
    }

    StorageFacade(UploadStrategySelector strategies, CacheIndex cache, LockManager locks, ObjectStoreClient store,
                  TaskSubmitter jobs, List<FileRecordSink> sinks, CloudStorageProperties props, Clock clock) {
        this.strategies = Objects.requireNonNull(strategies);
        this.cache = Objects.requireNonNull(cache);
        this.locks = Objects.requireNonNull(locks);
        this.store = Objects.requireNonNull(store);
        this.jobs = Objects.requireNonNull(jobs);
        this.sinks = sinks == null ? List.of() : List.copyOf(sinks);
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
    }

    public UploadResult upload(UploadSource source, String path, FileMetadata metadata) {
        return upload(source, path, metadata, CancellationSignal.none());
    }

    /**
     * Uploads {@code source} to {@code path} while holding the path's exclusive lock. A failed
     * upload is aborted in the store before the lock is released.
     */
    public UploadResult upload(UploadSource source, String path, FileMetadata metadata, CancellationSignal cancellation) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(metadata, "metadata");

        return locks.withExclusiveAccess(path, () -> {
            long size = source.size();
            UploadStrategy strategy = strategies.strategyFor(size);
            UploadRequest request = new UploadRequest(source, path, metadata.contentType(),
                    metadata.toUserMetadata(), chunkSizeFor(size), cancellation);

            FinalObjectDescriptor descriptor = strategy.upload(request);
            VersionStamp version = new VersionStamp(path, descriptor.eTag());

            if (metadata.fileId() != null) {
                cache.invalidateTag(FileMetadata.fileTag(metadata.fileId()));
            }
            cache.put(path, FileView.of(descriptor, metadata, clock.instant()), metadata.tags(),
                    props.getCache().getMetadataTtl());

            for (FileRecordSink sink : sinks) {
                sink.onUploaded(metadata, descriptor, version);
            }
            logger.info("Uploaded {} ({} bytes, {} part(s), {})", path, descriptor.size(), descriptor.partCount(), strategy.kind());
            return new UploadResult(descriptor, version, strategy.kind());
        });
    }

    /**
     * Runs {@link #upload} on the upload job pool.
     */
    public UploadTicket uploadAsync(UploadSource source, String path, FileMetadata metadata) {
        CancellationSignal cancellation = new CancellationSignal();
        return new UploadTicket(path, jobs.submit(() -> upload(source, path, metadata, cancellation)), cancellation);
    }

    /**
     * Metadata of the object at {@code path}, from cache or from the store.
     *
     * @throws StoredObjectNotFoundException if no such object exists
     */
    public FileView read(String path) {
        try {
            return cache.getOrCompute(path, FileView::tags, props.getCache().getMetadataTtl(), FileView.class,
                    () -> store.getMetadata(path)
                            .map(FileView::of)
                            .orElseThrow(() -> new StoredObjectNotFoundException(path)));
        } catch (CacheComputeException e) {
            if (e.getCause() instanceof StoredObjectNotFoundException notFound) {
                throw notFound;
            }
            throw e;
        }
    }

    /**
     * Drops every cache entry tagged with the given file, owner or folder. Null ids are skipped.
     */
    public void invalidate(String fileId, String ownerId, String folderId) {
        int removed = 0;
        if (fileId != null) removed += cache.invalidateTag(FileMetadata.fileTag(fileId));
        if (ownerId != null) removed += cache.invalidateTag(FileMetadata.userTag(ownerId));
        if (folderId != null) removed += cache.invalidateTag(FileMetadata.folderTag(folderId));
        logger.debug("Invalidated file={} user={} folder={}: {} entries", fileId, ownerId, folderId, removed);
    }

    public <T> T withExclusiveAccess(String path, Supplier<T> fn) {
        return locks.withExclusiveAccess(path, fn);
    }

    public VersionStamp compareAndSwapVersion(String path, VersionStamp expected, UnaryOperator<byte[]> mutateFn) {
        return locks.compareAndSwap(path, expected, mutateFn);
    }

    public QuotaSnapshot readQuota(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        return cache.getOrCompute(quotaKey(ownerId), Set.of(FileMetadata.userTag(ownerId), quotaTag(ownerId)),
                props.getCache().getMetadataTtl(), QuotaSnapshot.class, () -> loadQuota(ownerId));
    }

    /**
     * Adds {@code deltaBytes} to the owner's usage if the counter is still at {@code expected}.
     *
     * @throws org.iceforge.cloudstorage.lock.VersionConflictException if another writer got there first
     */
    public QuotaSnapshot adjustQuota(String ownerId, VersionStamp expected, long deltaBytes) {
        Objects.requireNonNull(ownerId, "ownerId");
        String path = quotaPath(ownerId);
        long[] used = new long[1];
        try {
            VersionStamp written = locks.compareAndSwap(path, expected, current -> {
                used[0] = Math.addExact(decodeQuota(path, current), deltaBytes);
                if (used[0] < 0) {
                    throw new IllegalArgumentException("Quota of " + ownerId + " would drop below zero");
                }
                return encodeQuota(used[0]);
            });
            return new QuotaSnapshot(ownerId, used[0], written);
        } finally {
            cache.invalidateTag(quotaTag(ownerId));
        }
    }

    long chunkSizeFor(long size) {
        long configured = props.getUpload().getChunkSizeBytes();
        int maxParts = props.getUpload().getMaxParts();
        if (ChunkPlanner.partCount(size, configured) <= maxParts) {
            return configured;
        }
        // grow parts so the plan fits the provider's part limit
        return size / maxParts + (size % maxParts == 0 ? 0 : 1);
    }

    private QuotaSnapshot loadQuota(String ownerId) {
        String path = quotaPath(ownerId);
        VersionStamp version = locks.readVersion(path);
        if (version.isAbsent()) {
            return new QuotaSnapshot(ownerId, 0L, version);
        }
        try {
            return new QuotaSnapshot(ownerId, decodeQuota(path, store.get(path)), version);
        } catch (ObjectStoreException e) {
            if (e.statusCode() == 404) {
                return new QuotaSnapshot(ownerId, 0L, VersionStamp.absent(path));
            }
            throw e;
        }
    }

    static String quotaPath(String ownerId) {
        return QUOTA_PREFIX + ownerId;
    }

    private static String quotaKey(String ownerId) {
        return "quota:" + ownerId;
    }

    private static String quotaTag(String ownerId) {
        return "quota:" + ownerId;
    }

    private static long decodeQuota(String path, byte[] body) {
        if (body == null || body.length == 0) {
            return 0L;
        }
        String text = new String(body, StandardCharsets.UTF_8).trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Corrupt quota counter at " + path + ": '" + text + "'", e);
        }
    }

    private static byte[] encodeQuota(long usedBytes) {
        return Long.toString(usedBytes).getBytes(StandardCharsets.UTF_8);
    }
}
