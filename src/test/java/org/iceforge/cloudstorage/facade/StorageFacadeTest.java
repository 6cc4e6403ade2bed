package org.iceforge.cloudstorage.facade;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.aws.s3.LocalFsObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.cache.CacheIndex;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.iceforge.cloudstorage.lock.LocalLockService;
import org.iceforge.cloudstorage.lock.LockManager;
import org.iceforge.cloudstorage.lock.VersionConflictException;
import org.iceforge.cloudstorage.lock.VersionStamp;
import org.iceforge.cloudstorage.task.ExecutorTaskSubmitter;
import org.iceforge.cloudstorage.upload.ChunkPlanner;
import org.iceforge.cloudstorage.upload.MultipartUploadCoordinator;
import org.iceforge.cloudstorage.upload.PartUploadException;
import org.iceforge.cloudstorage.upload.RetryPolicy;
import org.iceforge.cloudstorage.upload.UploadCancelledException;
import org.iceforge.cloudstorage.upload.UploadSource;
import org.iceforge.cloudstorage.upload.strategy.ChunkedUploadStrategy;
import org.iceforge.cloudstorage.upload.strategy.DirectUploadStrategy;
import org.iceforge.cloudstorage.upload.strategy.MultipartUploadStrategy;
import org.iceforge.cloudstorage.upload.strategy.UploadStrategy;
import org.iceforge.cloudstorage.upload.strategy.UploadStrategySelector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StorageFacadeTest {

    private static final Duration TTL = Duration.ofMinutes(1);
    private static final FileMetadata REPORT = new FileMetadata("f1", "alice", "docs", "application/pdf");

    @TempDir
    Path baseDir;

    private final ExecutorService partPool = Executors.newFixedThreadPool(4);
    private final ExecutorService jobPool = Executors.newFixedThreadPool(2);
    private final List<String> sunk = new CopyOnWriteArrayList<>();

    private CloudStorageProperties props;
    private LocalFsObjectStoreClient store;
    private LocalLockService lockService;
    private CacheIndex cache;
    private StorageFacade facade;

    @BeforeEach
    void setUp() {
        props = new CloudStorageProperties();
        props.setLocalBaseDir(baseDir.toString());
        props.getUpload().setChunkSizeBytes(64);
        store = spy(new LocalFsObjectStoreClient(props));
        lockService = spy(new LocalLockService());
        cache = new CacheIndex(Duration.ofSeconds(5), Clock.systemUTC(), StorageEventPublisher.noop());
        facade = facade(new RetryPolicy(3, 0, 0));
    }

    @AfterEach
    void tearDown() {
        partPool.shutdownNow();
        jobPool.shutdownNow();
    }

    private StorageFacade facade(RetryPolicy retry) {
        StorageEventPublisher events = StorageEventPublisher.noop();
        MultipartUploadCoordinator coordinator = new MultipartUploadCoordinator(store, new ChunkPlanner(16, 10_000), retry, events);
        List<UploadStrategy> strategies = List.of(
                new DirectUploadStrategy(store, retry, events),
                new MultipartUploadStrategy(coordinator),
                new ChunkedUploadStrategy(coordinator, new ExecutorTaskSubmitter(partPool), 2));
        LockManager locks = new LockManager(lockService, store, events, Clock.systemUTC(), TTL, Duration.ofSeconds(5));
        FileRecordSink sink = (metadata, descriptor, version) -> sunk.add(metadata.fileId() + "@" + version.version());
        return new StorageFacade(new UploadStrategySelector(100, 1000, strategies), cache, locks, store,
                new ExecutorTaskSubmitter(jobPool), List.of(sink), props, Clock.systemUTC());
    }

    private static byte[] randomBytes(int n) {
        byte[] b = new byte[n];
        new Random(n).nextBytes(b);
        return b;
    }

    @Test
    void upload_picksStrategyBySize() {
        assertEquals(UploadStrategy.Kind.DIRECT,
                facade.upload(UploadSource.of(randomBytes(50)), "a/small", REPORT).strategy());
        assertEquals(UploadStrategy.Kind.MULTIPART,
                facade.upload(UploadSource.of(randomBytes(300)), "a/medium", REPORT).strategy());
        UploadResult large = facade.upload(UploadSource.of(randomBytes(2000)), "a/large", REPORT);
        assertEquals(UploadStrategy.Kind.CHUNKED, large.strategy());

        assertEquals(32, large.descriptor().partCount());
        assertArrayEquals(randomBytes(2000), store.get("a/large"));
    }

    @Test
    void upload_cachesViewAndNotifiesSink() {
        UploadResult result = facade.upload(UploadSource.of(randomBytes(300)), "users/alice/report.pdf", REPORT);

        assertEquals(result.descriptor().eTag(), result.version().version());
        assertEquals(List.of("f1@" + result.version().version()), sunk);

        FileView cached = cache.get("users/alice/report.pdf", FileView.class).orElseThrow();
        assertEquals(300, cached.size());
        assertEquals(REPORT, cached.metadata());
        assertEquals(List.of("users/alice/report.pdf"), List.copyOf(cache.keysFor("folder:docs")));

        // served from cache
        assertEquals(cached, facade.read("users/alice/report.pdf"));
        verify(store, never()).getMetadata("users/alice/report.pdf");
    }

    @Test
    void failedUpload_isAbortedBeforeLockRelease() {
        doThrow(new ObjectStoreException("503", 503, true))
                .when(store).uploadPart(any(), eq(2), any(byte[].class));

        assertThrows(PartUploadException.class,
                () -> facade.upload(UploadSource.of(randomBytes(300)), "users/alice/broken.bin", REPORT));

        InOrder order = inOrder(store, lockService);
        order.verify(lockService).tryAcquire(eq("users/alice/broken.bin"), anyString(), eq(TTL));
        order.verify(store).abortMultipart(any());
        order.verify(lockService).release(eq("users/alice/broken.bin"), anyString());

        assertTrue(sunk.isEmpty());
        assertTrue(cache.get("users/alice/broken.bin", FileView.class).isEmpty());
        assertTrue(store.getMetadata("users/alice/broken.bin").isEmpty());
    }

    @Test
    void read_loadsFromStoreOnceThenFromCache() {
        store.putSingle("users/bob/photo.jpg", "jpeg".getBytes(StandardCharsets.UTF_8), "image/jpeg",
                Map.of("file-id", "f9", "owner-id", "bob", "folder-id", "pics"));

        FileView first = facade.read("users/bob/photo.jpg");
        FileView second = facade.read("users/bob/photo.jpg");

        assertEquals(new FileMetadata("f9", "bob", "pics", "image/jpeg"), first.metadata());
        assertEquals(4, first.size());
        assertEquals(first, second);
        verify(store, times(1)).getMetadata("users/bob/photo.jpg");
        assertEquals(1, cache.hits());
    }

    @Test
    void read_missingObject_throwsAndIsNotCached() {
        StoredObjectNotFoundException e = assertThrows(StoredObjectNotFoundException.class,
                () -> facade.read("nope"));
        assertEquals("nope", e.path());
        assertEquals(0, cache.entries());
    }

    @Test
    void invalidate_byOwner_dropsEntriesSoNextReadHitsStore() {
        facade.upload(UploadSource.of(randomBytes(50)), "users/alice/a.txt", REPORT);
        facade.upload(UploadSource.of(randomBytes(50)), "users/alice/b.txt",
                new FileMetadata("f2", "alice", "misc", "text/plain"));

        facade.invalidate(null, "alice", null);

        assertTrue(cache.get("users/alice/a.txt", FileView.class).isEmpty());
        assertTrue(cache.get("users/alice/b.txt", FileView.class).isEmpty());
        assertEquals("f1", facade.read("users/alice/a.txt").metadata().fileId());
        verify(store, times(1)).getMetadata("users/alice/a.txt");
    }

    @Test
    void reupload_replacesCachedView() {
        facade.upload(UploadSource.of(randomBytes(50)), "doc", REPORT);
        facade.upload(UploadSource.of(randomBytes(60)), "doc", REPORT);

        assertEquals(60, facade.read("doc").size());
        assertEquals(2, sunk.size());
    }

    @Test
    void quota_startsAtZeroAndTracksAdjustments() {
        QuotaSnapshot initial = facade.readQuota("alice");
        assertEquals(0, initial.usedBytes());
        assertTrue(initial.version().isAbsent());

        QuotaSnapshot afterUpload = facade.adjustQuota("alice", initial.version(), 300);
        assertEquals(300, afterUpload.usedBytes());

        QuotaSnapshot reread = facade.readQuota("alice");
        assertEquals(300, reread.usedBytes());
        assertEquals(afterUpload.version(), reread.version());
        assertEquals("300", new String(store.get(StorageFacade.quotaPath("alice")), StandardCharsets.UTF_8));
    }

    @Test
    void quota_staleVersion_conflicts() {
        QuotaSnapshot initial = facade.readQuota("alice");
        facade.adjustQuota("alice", initial.version(), 100);

        assertThrows(VersionConflictException.class, () -> facade.adjustQuota("alice", initial.version(), 50));
        assertEquals(100, facade.readQuota("alice").usedBytes());
    }

    @Test
    void quota_cannotGoNegative() {
        QuotaSnapshot initial = facade.readQuota("alice");

        assertThrows(IllegalArgumentException.class, () -> facade.adjustQuota("alice", initial.version(), -1));
        assertTrue(facade.readQuota("alice").version().isAbsent());
    }

    @Test
    void compareAndSwapVersion_delegatesToLockManager() {
        VersionStamp v = facade.compareAndSwapVersion("settings/alice", VersionStamp.absent("settings/alice"),
                current -> "{}".getBytes(StandardCharsets.UTF_8));
        assertFalse(v.isAbsent());
        assertEquals("ok", facade.withExclusiveAccess("other", () -> "ok"));
    }

    @Test
    void uploadAsync_completes() throws Exception {
        UploadTicket ticket = facade.uploadAsync(UploadSource.of(randomBytes(300)), "async/one", REPORT);

        UploadResult result = ticket.await(Duration.ofSeconds(5));
        assertEquals("async/one", result.descriptor().path());
        assertTrue(ticket.isDone());
        assertFalse(ticket.cancel());
    }

    @Test
    void uploadAsync_cancelledBeforeStart_storesNothing() {
        assertTrue(lockService.tryAcquire("async/two", "someone-else", TTL));
        UploadTicket ticket = facade.uploadAsync(UploadSource.of(randomBytes(300)), "async/two", REPORT);

        assertTrue(ticket.cancel());
        assertTrue(ticket.isCancelled());
        lockService.release("async/two", "someone-else");

        assertThrows(UploadCancelledException.class, () -> ticket.await(Duration.ofSeconds(5)));
        assertTrue(store.getMetadata("async/two").isEmpty());
        assertTrue(sunk.isEmpty());
    }

    @Test
    void chunkSize_growsToFitPartLimit() {
        props.getUpload().setChunkSizeBytes(64);
        props.getUpload().setMaxParts(4);

        assertEquals(64, facade.chunkSizeFor(256));
        assertEquals(250, facade.chunkSizeFor(1000));
        assertEquals(251, facade.chunkSizeFor(1001));
    }
}
