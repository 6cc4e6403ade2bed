package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.aws.s3.LocalFsObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.iceforge.cloudstorage.task.ExecutorTaskSubmitter;
import org.iceforge.cloudstorage.upload.ChunkPlanner;
import org.iceforge.cloudstorage.upload.FinalObjectDescriptor;
import org.iceforge.cloudstorage.upload.MultipartUploadCoordinator;
import org.iceforge.cloudstorage.upload.PartUploadException;
import org.iceforge.cloudstorage.upload.RetryPolicy;
import org.iceforge.cloudstorage.upload.UploadSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ChunkedUploadStrategyTest {

    @TempDir
    Path baseDir;

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ChunkedUploadStrategy strategy(ObjectStoreClient store, int maxInFlight) {
        MultipartUploadCoordinator coordinator = new MultipartUploadCoordinator(store, new ChunkPlanner(16, 10_000),
                new RetryPolicy(3, 0, 0), StorageEventPublisher.noop());
        return new ChunkedUploadStrategy(coordinator, new ExecutorTaskSubmitter(pool), maxInFlight);
    }

    @Test
    void streamSource_isReassembledInOrder() {
        CloudStorageProperties props = new CloudStorageProperties();
        props.setLocalBaseDir(baseDir.toString());
        LocalFsObjectStoreClient store = new LocalFsObjectStoreClient(props);

        byte[] data = new byte[1000];
        new Random(42).nextBytes(data);

        FinalObjectDescriptor d = strategy(store, 3).upload(new UploadRequest(
                UploadSource.of(new ByteArrayInputStream(data), data.length), "big/object.bin",
                "application/octet-stream", null, 64, null));

        assertEquals(16, d.partCount());
        assertTrue(d.eTag().endsWith("-16"));
        assertArrayEquals(data, store.get("big/object.bin"));
    }

    @Test
    void inFlightParts_areBounded() {
        ObjectStoreClient store = Mockito.mock(ObjectStoreClient.class);
        ObjectStoreModels.MultipartSession handle = new ObjectStoreModels.MultipartSession("p", "u");
        when(store.initiateMultipart(eq("p"), any(), anyMap())).thenReturn(handle);
        when(store.completeMultipart(eq(handle), anyList())).thenReturn(new ObjectStoreModels.ObjectDescriptor("p", "e", null));

        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(store.uploadPart(eq(handle), anyInt(), any(byte[].class))).thenAnswer(inv -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(5);
            current.decrementAndGet();
            return "e" + inv.getArgument(1, Integer.class);
        });

        strategy(store, 2).upload(new UploadRequest(UploadSource.of(new byte[320]), "p", null, null, 16, null));

        verify(store, times(20)).uploadPart(eq(handle), anyInt(), any(byte[].class));
        assertTrue(peak.get() <= 2, "peak in-flight parts was " + peak.get());
    }

    @Test
    void failedPart_waitsForOthersThenAborts() {
        ObjectStoreClient store = Mockito.mock(ObjectStoreClient.class);
        ObjectStoreModels.MultipartSession handle = new ObjectStoreModels.MultipartSession("p", "u");
        when(store.initiateMultipart(eq("p"), any(), anyMap())).thenReturn(handle);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger runningAtAbort = new AtomicInteger(-1);
        when(store.uploadPart(eq(handle), anyInt(), any(byte[].class))).thenAnswer(inv -> {
            int seq = inv.getArgument(1, Integer.class);
            running.incrementAndGet();
            try {
                if (seq == 3) {
                    throw new ObjectStoreException("403", 403, false);
                }
                Thread.sleep(10);
                return "e" + seq;
            } finally {
                running.decrementAndGet();
            }
        });
        doAnswer(inv -> {
            runningAtAbort.set(running.get());
            return null;
        }).when(store).abortMultipart(handle);

        PartUploadException e = assertThrows(PartUploadException.class, () ->
                strategy(store, 4).upload(new UploadRequest(UploadSource.of(new byte[320]), "p", null, null, 16, null)));

        assertEquals(3, e.sequenceNumber());
        verify(store).abortMultipart(handle);
        verify(store, never()).completeMultipart(any(), anyList());
        assertEquals(0, runningAtAbort.get());
    }
}
