package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.aws.s3.ObjectStoreClient;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreModels;
import org.iceforge.cloudstorage.event.StorageEvent;
import org.iceforge.cloudstorage.event.StorageEventCounters;
import org.iceforge.cloudstorage.event.StorageEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MultipartUploadCoordinatorTest {

    private static final long MIB = 1024L * 1024;
    private static final String PATH = "users/u1/big.bin";

    @Mock
    private ObjectStoreClient store;

    private StorageEventCounters counters;
    private MultipartUploadCoordinator coordinator;
    private final ObjectStoreModels.MultipartSession handle = new ObjectStoreModels.MultipartSession(PATH, "up-1");

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        counters = new StorageEventCounters();
        coordinator = new MultipartUploadCoordinator(
                store,
                new ChunkPlanner(5 * MIB, 10_000),
                new RetryPolicy(3, 0, 0),
                new StorageEventPublisher(List.of(counters)));

        when(store.initiateMultipart(eq(PATH), any(), anyMap())).thenReturn(handle);
        when(store.uploadPart(eq(handle), anyInt(), any(byte[].class)))
                .thenAnswer(inv -> "etag-" + inv.getArgument(1, Integer.class));
        when(store.completeMultipart(eq(handle), anyList()))
                .thenReturn(new ObjectStoreModels.ObjectDescriptor(PATH, "final-etag-3", "v1"));
    }

    private UploadSession start12MiB() {
        return coordinator.startUpload(UploadSource.of(new byte[(int) (12 * MIB)]), PATH, 5 * MIB);
    }

    @SuppressWarnings("unchecked")
    @Test
    void uploadsThreePartsAndCompletesInOrder() {
        UploadSession session = start12MiB();
        assertEquals(UploadState.UPLOADING, session.state());
        assertEquals(3, session.partCount());

        // any order is fine; the store sorts by sequence number on completion
        List<PartRange> plan = session.plan();
        coordinator.uploadPart(session, plan.get(2));
        coordinator.uploadPart(session, plan.get(0));
        coordinator.uploadPart(session, plan.get(1));

        FinalObjectDescriptor done = coordinator.completeUpload(session);

        ArgumentCaptor<List<ObjectStoreModels.CompletedPart>> parts = ArgumentCaptor.forClass(List.class);
        verify(store).completeMultipart(eq(handle), parts.capture());
        assertEquals(List.of(
                new ObjectStoreModels.CompletedPart(1, "etag-1"),
                new ObjectStoreModels.CompletedPart(2, "etag-2"),
                new ObjectStoreModels.CompletedPart(3, "etag-3")
        ), parts.getValue());

        verify(store).uploadPart(eq(handle), eq(3), argThat(b -> b.length == 2 * MIB));
        assertEquals(UploadState.COMPLETED, session.state());
        assertEquals(new FinalObjectDescriptor(PATH, "final-etag-3", "v1", 12 * MIB, 3), done);
        assertEquals(1, counters.count(StorageEvent.Type.UPLOAD_COMPLETED));
    }

    @Test
    void transientPartFailure_exhaustsThreeAttempts_thenFailsAndAborts() {
        when(store.uploadPart(eq(handle), eq(2), any(byte[].class)))
                .thenThrow(new ObjectStoreException("503 slow down", 503, true));

        UploadSession session = start12MiB();
        List<PartRange> plan = session.plan();
        coordinator.uploadPart(session, plan.get(0));

        PartUploadException e = assertThrows(PartUploadException.class,
                () -> coordinator.uploadPart(session, plan.get(1)));

        assertEquals(2, e.sequenceNumber());
        assertEquals(3, e.attempts());
        verify(store, times(3)).uploadPart(eq(handle), eq(2), any(byte[].class));
        assertEquals(UploadState.FAILED, session.state());
        assertEquals(PartStatus.FAILED, session.part(2).status());
        assertEquals(PartStatus.COMMITTED, session.part(1).status());
        assertEquals(2, counters.count(StorageEvent.Type.PART_RETRIED));
        assertEquals(1, counters.count(StorageEvent.Type.PART_FAILED));

        coordinator.abortUpload(session);

        verify(store).abortMultipart(handle);
        assertTrue(session.storeAborted());
        assertEquals(UploadState.FAILED, session.state());

        // second abort has nothing left to do
        coordinator.abortUpload(session);
        verify(store, times(1)).abortMultipart(handle);
    }

    @Test
    void nonRetryableFailure_isNotRetried() {
        when(store.uploadPart(eq(handle), eq(1), any(byte[].class)))
                .thenThrow(new ObjectStoreException("403 denied", 403, false));

        UploadSession session = start12MiB();

        PartUploadException e = assertThrows(PartUploadException.class,
                () -> coordinator.uploadPart(session, session.plan().get(0)));
        assertEquals(1, e.attempts());
        verify(store, times(1)).uploadPart(eq(handle), eq(1), any(byte[].class));
    }

    @Test
    void completeWithUncommittedParts_listsThem_andNeverCallsStore() {
        UploadSession session = start12MiB();
        coordinator.uploadPart(session, session.plan().get(0));

        IncompletePartsException e = assertThrows(IncompletePartsException.class,
                () -> coordinator.completeUpload(session));

        assertEquals(List.of(2, 3), e.incompleteParts());
        verify(store, never()).completeMultipart(any(), anyList());
        assertEquals(UploadState.UPLOADING, session.state());
    }

    @Test
    void completeWithNoCommittedParts_listsAll() {
        UploadSession session = start12MiB();

        IncompletePartsException e = assertThrows(IncompletePartsException.class,
                () -> coordinator.completeUpload(session));

        assertEquals(List.of(1, 2, 3), e.incompleteParts());
    }

    @Test
    void completeAfterPartFailure_listsFailedAndPendingParts() {
        when(store.uploadPart(eq(handle), eq(2), any(byte[].class)))
                .thenThrow(new ObjectStoreException("400 bad digest", 400, false));

        UploadSession session = start12MiB();
        List<PartRange> plan = session.plan();
        coordinator.uploadPart(session, plan.get(0));
        assertThrows(PartUploadException.class, () -> coordinator.uploadPart(session, plan.get(1)));
        assertEquals(UploadState.FAILED, session.state());

        IncompletePartsException e = assertThrows(IncompletePartsException.class,
                () -> coordinator.completeUpload(session));

        assertEquals(List.of(2, 3), e.incompleteParts());
        verify(store, never()).completeMultipart(any(), anyList());
        assertEquals(UploadState.FAILED, session.state());
    }

    @Test
    void completeAfterCompletion_isRejected() {
        UploadSession session = start12MiB();
        for (PartRange range : session.plan()) {
            coordinator.uploadPart(session, range);
        }
        coordinator.completeUpload(session);

        assertThrows(IllegalStateException.class, () -> coordinator.completeUpload(session));
        verify(store, times(1)).completeMultipart(eq(handle), anyList());
    }

    @Test
    void committedPart_isNotResent() {
        UploadSession session = start12MiB();
        PartRange first = session.plan().get(0);

        coordinator.uploadPart(session, first);
        coordinator.uploadPart(session, first);

        verify(store, times(1)).uploadPart(eq(handle), eq(1), any(byte[].class));
        assertEquals("etag-1", session.part(1).eTag());
        assertEquals(1, session.part(1).attempts());
    }

    @Test
    void initiationRejected_throwsInitiationException() {
        when(store.initiateMultipart(eq(PATH), any(), anyMap()))
                .thenThrow(new ObjectStoreException("quota exceeded", 403, false));

        InitiationException e = assertThrows(InitiationException.class, this::start12MiB);
        assertInstanceOf(ObjectStoreException.class, e.getCause());
        verify(store, never()).uploadPart(any(), anyInt(), any());
    }

    @Test
    void completionRejected_failsSession() {
        when(store.completeMultipart(eq(handle), anyList()))
                .thenThrow(new ObjectStoreException("bad part order", 400, false));

        UploadSession session = start12MiB();
        session.plan().forEach(p -> coordinator.uploadPart(session, p));

        assertThrows(CompletionException.class, () -> coordinator.completeUpload(session));
        assertEquals(UploadState.FAILED, session.state());
    }

    @Test
    void abortWhileUploading_isIdempotent_andBlocksFurtherParts() {
        UploadSession session = start12MiB();
        coordinator.uploadPart(session, session.plan().get(0));

        coordinator.abortUpload(session);
        coordinator.abortUpload(session);

        verify(store, times(1)).abortMultipart(handle);
        assertEquals(UploadState.ABORTED, session.state());
        assertEquals(1, counters.count(StorageEvent.Type.UPLOAD_ABORTED));
        assertThrows(IllegalStateException.class, () -> coordinator.uploadPart(session, session.plan().get(1)));
    }

    @Test
    void abortRetriesTransientFailures() {
        doThrow(new ObjectStoreException("503", 503, true))
                .doNothing()
                .when(store).abortMultipart(handle);

        UploadSession session = start12MiB();
        coordinator.abortUpload(session);

        verify(store, times(2)).abortMultipart(handle);
        assertEquals(UploadState.ABORTED, session.state());
    }

    @Test
    void abortAfterCompletion_isRejected() {
        UploadSession session = start12MiB();
        session.plan().forEach(p -> coordinator.uploadPart(session, p));
        coordinator.completeUpload(session);

        assertThrows(IllegalStateException.class, () -> coordinator.abortUpload(session));
        verify(store, never()).abortMultipart(any());
    }

    @Test
    void cancelledSession_stopsBeforeNextAttempt() {
        CancellationSignal cancel = new CancellationSignal();
        UploadSession session = coordinator.startUpload(UploadSource.of(new byte[(int) (12 * MIB)]), PATH, 5 * MIB,
                "application/octet-stream", Map.of(), cancel);
        cancel.cancel();

        assertThrows(UploadCancelledException.class, () -> coordinator.uploadPart(session, session.plan().get(0)));
        verify(store, never()).uploadPart(any(), anyInt(), any());
    }
}
