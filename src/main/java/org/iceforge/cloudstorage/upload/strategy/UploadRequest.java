package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.upload.CancellationSignal;
import org.iceforge.cloudstorage.upload.UploadSource;

import java.util.Map;
import java.util.Objects;

public record UploadRequest(
        UploadSource source,
        String path,
        String contentType,
        Map<String, String> userMetadata,
        long chunkSize,
        CancellationSignal cancellation
) {
    public UploadRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(path, "path");
        userMetadata = userMetadata == null ? Map.of() : Map.copyOf(userMetadata);
        cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    }
}
