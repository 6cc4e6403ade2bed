package org.iceforge.cloudstorage.aws.s3;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
@ConditionalOnProperty(prefix = "cloudstorage", name = "store", havingValue = "s3", matchIfMissing = true)
public class AwsSdkObjectStoreClient implements ObjectStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkObjectStoreClient.class);
    private final S3Client s3;
    private final String bucket;

    public AwsSdkObjectStoreClient(S3Client s3, CloudStorageProperties props) {
        this.s3 = Objects.requireNonNull(s3);
        this.bucket = props.getBucket();
    }

    @Override
    public ObjectStoreModels.MultipartSession initiateMultipart(String path, String contentType, Map<String, String> userMetadata) {
        try {
            CreateMultipartUploadRequest.Builder req = CreateMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(path);

            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);
            if (userMetadata != null && !userMetadata.isEmpty()) req = req.metadata(userMetadata);

            CreateMultipartUploadResponse resp = s3.createMultipartUpload(req.build());
            return new ObjectStoreModels.MultipartSession(path, resp.uploadId());
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 createMultipartUpload failed for s3://{}/{}", bucket, path, e);
            throw translate("createMultipartUpload", path, e);
        }
    }

    @Override
    public String uploadPart(ObjectStoreModels.MultipartSession session, int partNumber, byte[] bytes) {
        try {
            UploadPartResponse resp = s3.uploadPart(UploadPartRequest.builder()
                    .bucket(bucket)
                    .key(session.path())
                    .uploadId(session.uploadId())
                    .partNumber(partNumber)
                    .contentLength((long) bytes.length)
                    .build(), RequestBody.fromBytes(bytes));
            return resp.eTag();
        } catch (S3Exception | SdkClientException e) {
            logger.warn("S3 uploadPart {} failed for s3://{}/{}: {}", partNumber, bucket, session.path(), e.getMessage());
            throw translate("uploadPart", session.path(), e);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor completeMultipart(ObjectStoreModels.MultipartSession session,
                                                                List<ObjectStoreModels.CompletedPart> parts) {
        List<CompletedPart> completed = parts.stream()
                .map(p -> CompletedPart.builder().partNumber(p.partNumber()).eTag(p.eTag()).build())
                .toList();
        try {
            CompleteMultipartUploadResponse done = s3.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(session.path())
                    .uploadId(session.uploadId())
                    .multipartUpload(CompletedMultipartUpload.builder().parts(completed).build())
                    .build());
            return new ObjectStoreModels.ObjectDescriptor(session.path(), done.eTag(), done.versionId());
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 completeMultipartUpload failed for s3://{}/{}", bucket, session.path(), e);
            throw translate("completeMultipartUpload", session.path(), e);
        }
    }

    @Override
    public void abortMultipart(ObjectStoreModels.MultipartSession session) {
        try {
            s3.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(session.path())
                    .uploadId(session.uploadId())
                    .build());
        } catch (NoSuchUploadException e) {
            // already aborted or completed elsewhere
            logger.debug("Multipart upload {} for s3://{}/{} no longer exists", session.uploadId(), bucket, session.path());
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 abortMultipartUpload failed for s3://{}/{}", bucket, session.path(), e);
            throw translate("abortMultipartUpload", session.path(), e);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor putSingle(String path, byte[] bytes, String contentType, Map<String, String> userMetadata) {
        try {
            PutObjectRequest.Builder req = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(path);

            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);
            if (userMetadata != null && !userMetadata.isEmpty()) req = req.metadata(userMetadata);

            PutObjectResponse resp = s3.putObject(req.build(), RequestBody.fromBytes(bytes));
            return new ObjectStoreModels.ObjectDescriptor(path, resp.eTag(), resp.versionId());
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 putObject failed for s3://{}/{}", bucket, path, e);
            throw translate("putObject", path, e);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor putConditional(String path, byte[] bytes, String expectedETag) {
        PutObjectRequest.Builder req = PutObjectRequest.builder()
                .bucket(bucket)
                .key(path);
        req = expectedETag == null ? req.ifNoneMatch("*") : req.ifMatch(expectedETag);
        try {
            PutObjectResponse resp = s3.putObject(req.build(), RequestBody.fromBytes(bytes));
            return new ObjectStoreModels.ObjectDescriptor(path, resp.eTag(), resp.versionId());
        } catch (S3Exception | SdkClientException e) {
            ObjectStoreException translated = translate("conditional putObject", path, e);
            if (!translated.preconditionFailed()) {
                logger.error("S3 conditional putObject failed for s3://{}/{}", bucket, path, e);
            }
            throw translated;
        }
    }

    @Override
    public Optional<ObjectStoreModels.ObjectMetadata> getMetadata(String path) {
        try {
            HeadObjectResponse r = s3.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(path)
                    .build());

            return Optional.of(new ObjectStoreModels.ObjectMetadata(
                    path,
                    r.contentLength() == null ? 0L : r.contentLength(),
                    r.eTag(),
                    r.versionId(),
                    r.contentType(),
                    r.lastModified(),
                    r.metadata() == null ? Map.of() : r.metadata()
            ));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // Some S3-compatible APIs throw generic 404 as S3Exception; treat 404 as not-found.
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            logger.error("S3 head failed for s3://{}/{}", bucket, path, e);
            throw translate("headObject", path, e);
        } catch (SdkClientException e) {
            logger.error("S3 head failed for s3://{}/{}", bucket, path, e);
            throw translate("headObject", path, e);
        }
    }

    @Override
    public byte[] get(String path) {
        try (ResponseInputStream<GetObjectResponse> ris = s3.getObject(
                GetObjectRequest.builder().bucket(bucket).key(path).build()
        )) {
            return readAllBytes(ris);
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 getObject failed for s3://{}/{}", bucket, path, e);
            throw translate("getObject", path, e);
        } catch (IOException e) {
            throw new ObjectStoreException("S3 getObject failed: s3://" + bucket + "/" + path, e, 0, true);
        }
    }

    @Override
    public void delete(String path) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(path).build());
        } catch (S3Exception | SdkClientException e) {
            logger.error("S3 delete failed for s3://{}/{}", bucket, path, e);
            throw translate("deleteObject", path, e);
        }
    }

    private ObjectStoreException translate(String operation, String path, RuntimeException e) {
        String message = "S3 " + operation + " failed: s3://" + bucket + "/" + path;
        if (e instanceof S3Exception s3e) {
            int status = s3e.statusCode();
            return new ObjectStoreException(message, e, status, status >= 500 || status == 429);
        }
        // client-side: connection failures, api call timeouts
        return new ObjectStoreException(message, e, 0, true);
    }

    private static byte[] readAllBytes(InputStream in) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int r;
        while ((r = in.read(buf)) != -1) baos.write(buf, 0, r);
        return baos.toByteArray();
    }
}
