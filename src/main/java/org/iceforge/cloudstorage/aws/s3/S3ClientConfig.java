package org.iceforge.cloudstorage.aws.s3;

import org.iceforge.cloudstorage.aws.CloudStorageAwsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration class for the AWS S3 client. Every call made through the client is bounded by
 * the api-call and per-attempt timeouts.
 */
@Configuration
@ConditionalOnProperty(prefix = "cloudstorage", name = "store", havingValue = "s3", matchIfMissing = true)
public class S3ClientConfig {

    private static final Duration DEFAULT_API_CALL_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(30);

    @Bean(destroyMethod = "close")
    public S3Client s3Client(CloudStorageAwsProperties props) {
        CloudStorageAwsProperties.S3Properties s3 = props.s3();
        Duration callTimeout = s3 != null && s3.apiCallTimeout() != null ? s3.apiCallTimeout() : DEFAULT_API_CALL_TIMEOUT;
        Duration attemptTimeout = s3 != null && s3.apiCallAttemptTimeout() != null ? s3.apiCallAttemptTimeout() : DEFAULT_ATTEMPT_TIMEOUT;

        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(props.region()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(callTimeout)
                        .apiCallAttemptTimeout(attemptTimeout)
                        .build())
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(s3 != null && s3.pathStyleAccess())
                                .build()
                );

        if (s3 != null && s3.endpoint() != null && !s3.endpoint().isBlank()) {
            b = b.endpointOverride(URI.create(s3.endpoint()));
        }

        return b.build();
    }
}
