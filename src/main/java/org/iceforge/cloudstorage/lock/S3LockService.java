package org.iceforge.cloudstorage.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.aws.s3.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cross-instance lock backed by a small JSON object per path under the lock prefix.
 * <p>
 * Acquire writes the lock object with {@code If-None-Match: *}. If a lock object exists but
 * has expired, it is taken over with {@code If-Match: <etag>} so that only one of several
 * racing acquirers replaces it.
 */
@Service
@ConditionalOnProperty(prefix = "cloudstorage", name = "store", havingValue = "s3", matchIfMissing = true)
public class S3LockService implements LockService {

    private static final Logger log = LoggerFactory.getLogger(S3LockService.class);

    record LockRecord(String token, long acquiredAtMillis, long expiresAtMillis) {}

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Autowired
    public S3LockService(S3Client s3, CloudStorageProperties props, ObjectMapper mapper) {
        this(s3, props.getBucket(), props.getLock().getPrefix(), mapper, Clock.systemUTC());
    }

    public S3LockService(S3Client s3, String bucket, String prefix, ObjectMapper mapper, Clock clock) {
        this.s3 = Objects.requireNonNull(s3);
        this.bucket = Objects.requireNonNull(bucket);
        this.prefix = prefix == null ? "" : prefix.replaceAll("/+$", "");
        this.mapper = Objects.requireNonNull(mapper);
        this.clock = Objects.requireNonNull(clock);
    }

    String lockKey(String path) {
        String p = path.startsWith("/") ? path.substring(1) : path;
        return prefix.isEmpty() ? p + ".lock" : prefix + "/" + p + ".lock";
    }

    @Override
    public boolean tryAcquire(String path, String token, Duration ttl) {
        Objects.requireNonNull(path);
        Objects.requireNonNull(token);
        String key = lockKey(path);
        Instant now = clock.instant();
        byte[] body = encode(new LockRecord(token, now.toEpochMilli(), now.plus(ttl).toEpochMilli()));

        for (int i = 0; i < 3; i++) {
            if (put(key, body, null)) {
                return true;
            }
            ResponseBytes<GetObjectResponse> current = fetch(key);
            if (current == null) {
                // released between our put and our read
                continue;
            }
            LockRecord holder = decode(key, current.asByteArray());
            if (holder != null && holder.expiresAtMillis() > now.toEpochMilli()) {
                return false;
            }
            log.info("Taking over expired lock s3://{}/{} (held by {})", bucket, key, holder == null ? "?" : holder.token());
            return put(key, body, current.response().eTag());
        }

        log.debug("S3 lock contention for s3://{}/{}", bucket, key);
        return false;
    }

    @Override
    public boolean release(String path, String token) {
        String key = lockKey(path);
        ResponseBytes<GetObjectResponse> current = fetch(key);
        if (current == null) {
            return false;
        }
        LockRecord holder = decode(key, current.asByteArray());
        if (holder == null || !token.equals(holder.token())) {
            log.debug("Not releasing s3://{}/{}: held by another owner", bucket, key);
            return false;
        }
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (S3Exception | SdkClientException e) {
            throw translate("deleteObject", key, e);
        }
    }

    /**
     * @return false if the precondition rejected the write
     */
    private boolean put(String key, byte[] body, String expectedETag) {
        PutObjectRequest.Builder req = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("application/json");
        req = expectedETag == null ? req.ifNoneMatch("*") : req.ifMatch(expectedETag);
        try {
            s3.putObject(req.build(), RequestBody.fromBytes(body));
            return true;
        } catch (S3Exception | SdkClientException e) {
            ObjectStoreException translated = translate("putObject", key, e);
            if (translated.preconditionFailed()) {
                return false;
            }
            log.warn("Failed to write lock object s3://{}/{}: {}", bucket, key, e.getMessage());
            throw translated;
        }
    }

    private ResponseBytes<GetObjectResponse> fetch(String key) {
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (NoSuchKeyException e) {
            return null;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return null;
            }
            throw translate("getObject", key, e);
        } catch (SdkClientException e) {
            throw translate("getObject", key, e);
        }
    }

    private byte[] encode(LockRecord lock) {
        try {
            return mapper.writeValueAsBytes(lock);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode lock record", e);
        }
    }

    // an unreadable lock object is treated as expired
    private LockRecord decode(String key, byte[] body) {
        try {
            return mapper.readValue(body, LockRecord.class);
        } catch (IOException e) {
            log.warn("Unreadable lock object s3://{}/{}: {}", bucket, key, e.getMessage());
            return null;
        }
    }

    private ObjectStoreException translate(String operation, String key, RuntimeException e) {
        String message = "S3 " + operation + " failed: s3://" + bucket + "/" + key;
        if (e instanceof S3Exception s3e) {
            int status = s3e.statusCode();
            return new ObjectStoreException(message, e, status, status >= 500 || status == 429);
        }
        return new ObjectStoreException(message, e, 0, true);
    }
}
