package org.iceforge.cloudstorage.aws.s3;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability wrapper over the remote object store. Every call is bounded by the
 * client's configured timeouts and fails with {@link ObjectStoreException}.
 */
public interface ObjectStoreClient {

    // Multipart
    ObjectStoreModels.MultipartSession initiateMultipart(String path, String contentType, Map<String, String> userMetadata);
    String uploadPart(ObjectStoreModels.MultipartSession session, int partNumber, byte[] bytes);
    ObjectStoreModels.ObjectDescriptor completeMultipart(ObjectStoreModels.MultipartSession session, List<ObjectStoreModels.CompletedPart> parts);
    void abortMultipart(ObjectStoreModels.MultipartSession session);

    // Single shot
    ObjectStoreModels.ObjectDescriptor putSingle(String path, byte[] bytes, String contentType, Map<String, String> userMetadata);

    /**
     * Writes only if the object's current ETag equals {@code expectedETag}, or, when
     * {@code expectedETag} is null, only if the object does not exist. A rejected write fails
     * with an exception whose {@link ObjectStoreException#preconditionFailed()} is true.
     */
    ObjectStoreModels.ObjectDescriptor putConditional(String path, byte[] bytes, String expectedETag);

    // Read
    Optional<ObjectStoreModels.ObjectMetadata> getMetadata(String path);
    byte[] get(String path);

    void delete(String path);
}
