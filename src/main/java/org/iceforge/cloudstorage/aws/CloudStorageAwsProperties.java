package org.iceforge.cloudstorage.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cloudstorage.aws")
public record CloudStorageAwsProperties(
        String region,
        S3Properties s3
) {
    public record S3Properties(
            String endpoint,
            boolean pathStyleAccess,
            Duration apiCallTimeout,
            Duration apiCallAttemptTimeout
    ) {}
}
