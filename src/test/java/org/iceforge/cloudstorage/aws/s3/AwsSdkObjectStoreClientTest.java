package org.iceforge.cloudstorage.aws.s3;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AwsSdkObjectStoreClientTest {

    @Mock
    private S3Client s3Client;

    private AwsSdkObjectStoreClient client;
    private final ObjectStoreModels.MultipartSession session = new ObjectStoreModels.MultipartSession("k", "up-1");

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        CloudStorageProperties props = new CloudStorageProperties();
        props.setBucket("bucket");
        client = new AwsSdkObjectStoreClient(s3Client, props);
    }

    @Test
    void initiateMultipart_passesContentTypeAndMetadata() {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("up-1").build());

        ObjectStoreModels.MultipartSession s = client.initiateMultipart("k", "text/plain", Map.of("file-id", "f1"));

        assertEquals(session, s);
        ArgumentCaptor<CreateMultipartUploadRequest> req = ArgumentCaptor.forClass(CreateMultipartUploadRequest.class);
        verify(s3Client).createMultipartUpload(req.capture());
        assertEquals("bucket", req.getValue().bucket());
        assertEquals("text/plain", req.getValue().contentType());
        assertEquals(Map.of("file-id", "f1"), req.getValue().metadata());
    }

    @Test
    void uploadPart_returnsETag() {
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenReturn(UploadPartResponse.builder().eTag("\"p1\"").build());

        assertEquals("\"p1\"", client.uploadPart(session, 1, new byte[]{1}));

        ArgumentCaptor<UploadPartRequest> req = ArgumentCaptor.forClass(UploadPartRequest.class);
        verify(s3Client).uploadPart(req.capture(), any(RequestBody.class));
        assertEquals(1, req.getValue().partNumber());
        assertEquals("up-1", req.getValue().uploadId());
    }

    @Test
    void serverErrors_areRetryable_clientErrorsAreNot() {
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(503).message("slow down").build())
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build())
                .thenThrow(SdkClientException.create("connection reset"));

        ObjectStoreException first = assertThrows(ObjectStoreException.class, () -> client.uploadPart(session, 1, new byte[1]));
        ObjectStoreException second = assertThrows(ObjectStoreException.class, () -> client.uploadPart(session, 1, new byte[1]));
        ObjectStoreException third = assertThrows(ObjectStoreException.class, () -> client.uploadPart(session, 1, new byte[1]));

        assertTrue(first.retryable());
        assertEquals(503, first.statusCode());
        assertFalse(second.retryable());
        assertTrue(third.retryable());
        assertEquals(0, third.statusCode());
    }

    @Test
    void completeMultipart_sendsOrderedParts() {
        when(s3Client.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenReturn(CompleteMultipartUploadResponse.builder().eTag("final").versionId("v2").build());

        ObjectStoreModels.ObjectDescriptor d = client.completeMultipart(session, List.of(
                new ObjectStoreModels.CompletedPart(1, "a"), new ObjectStoreModels.CompletedPart(2, "b")));

        assertEquals(new ObjectStoreModels.ObjectDescriptor("k", "final", "v2"), d);
        ArgumentCaptor<CompleteMultipartUploadRequest> req = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3Client).completeMultipartUpload(req.capture());
        List<CompletedPart> parts = req.getValue().multipartUpload().parts();
        assertEquals(2, parts.size());
        assertEquals(1, parts.get(0).partNumber());
        assertEquals("b", parts.get(1).eTag());
    }

    @Test
    void abortMultipart_missingUpload_isNoOp() {
        when(s3Client.abortMultipartUpload(any(AbortMultipartUploadRequest.class)))
                .thenThrow(NoSuchUploadException.builder().statusCode(404).message("gone").build());

        assertDoesNotThrow(() -> client.abortMultipart(session));
    }

    @Test
    void putConditional_usesIfNoneMatchForAbsent_andIfMatchOtherwise() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().eTag("e2").build());

        client.putConditional("k", new byte[0], null);
        client.putConditional("k", new byte[0], "e1");

        ArgumentCaptor<PutObjectRequest> req = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client, times(2)).putObject(req.capture(), any(RequestBody.class));
        assertEquals("*", req.getAllValues().get(0).ifNoneMatch());
        assertNull(req.getAllValues().get(0).ifMatch());
        assertEquals("e1", req.getAllValues().get(1).ifMatch());
    }

    @Test
    void putConditional_preconditionFailure_isFlagged() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(412).message("precondition").build());

        ObjectStoreException e = assertThrows(ObjectStoreException.class, () -> client.putConditional("k", new byte[0], "e1"));
        assertTrue(e.preconditionFailed());
        assertFalse(e.retryable());
    }

    @Test
    void getMetadata_mapsHeadResponse_andMissingIsEmpty() {
        Instant lm = Instant.parse("2026-01-01T00:00:00Z");
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(42L).eTag("e").contentType("text/plain")
                        .lastModified(lm).metadata(Map.of("owner-id", "u1")).build())
                .thenThrow(NoSuchKeyException.builder().statusCode(404).build());

        Optional<ObjectStoreModels.ObjectMetadata> found = client.getMetadata("k");
        assertTrue(found.isPresent());
        assertEquals(42L, found.get().size());
        assertEquals("u1", found.get().userMetadata().get("owner-id"));
        assertEquals(lm, found.get().lastModified());

        assertTrue(client.getMetadata("k").isEmpty());
    }
}
