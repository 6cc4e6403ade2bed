package org.iceforge.cloudstorage.aws.s3;

import java.time.Instant;
import java.util.Map;

public final class ObjectStoreModels {

    private ObjectStoreModels() {}

    /** Opaque handle of an in-flight multipart upload. */
    public record MultipartSession(String path, String uploadId) {}

    public record CompletedPart(int partNumber, String eTag) {}

    public record ObjectDescriptor(String path, String eTag, String versionId) {}

    public record ObjectMetadata(
            String path,
            long size,
            String eTag,
            String versionId,
            String contentType,
            Instant lastModified,
            Map<String, String> userMetadata
    ) {}
}
