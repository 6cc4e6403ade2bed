package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks an upload strategy by object size:
 * {@code size <= directMaxBytes} goes DIRECT, {@code size >= chunkedAboveBytes} goes CHUNKED,
 * everything in between goes MULTIPART.
 */
@Component
public class UploadStrategySelector {

    private final long directMaxBytes;
    private final long chunkedAboveBytes;
    private final Map<UploadStrategy.Kind, UploadStrategy> strategies = new EnumMap<>(UploadStrategy.Kind.class);

    @Autowired
    public UploadStrategySelector(CloudStorageProperties props, List<UploadStrategy> strategies) {
        this(props.getUpload().getDirectMaxBytes(), props.getUpload().getChunkedAboveBytes(), strategies);
    }

    public UploadStrategySelector(long directMaxBytes, long chunkedAboveBytes, List<UploadStrategy> strategies) {
        if (directMaxBytes < 0 || chunkedAboveBytes < directMaxBytes) {
            throw new IllegalArgumentException("require 0 <= directMaxBytes <= chunkedAboveBytes");
        }
        this.directMaxBytes = directMaxBytes;
        this.chunkedAboveBytes = chunkedAboveBytes;
        for (UploadStrategy s : strategies) {
            UploadStrategy previous = this.strategies.put(s.kind(), s);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate upload strategy for " + s.kind());
            }
        }
    }

    public UploadStrategy.Kind select(long size) {
        if (size <= directMaxBytes) {
            return UploadStrategy.Kind.DIRECT;
        }
        if (size >= chunkedAboveBytes) {
            return UploadStrategy.Kind.CHUNKED;
        }
        return UploadStrategy.Kind.MULTIPART;
    }

    public UploadStrategy strategyFor(long size) {
        UploadStrategy.Kind kind = select(size);
        UploadStrategy strategy = strategies.get(kind);
        if (strategy == null) {
            throw new IllegalStateException("No upload strategy registered for " + kind);
        }
        return strategy;
    }
}
