package org.iceforge.cloudstorage.aws.s3;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link ObjectStoreClient}.
 *
 * <p>This is intended for dev / integration-test mode so the engine can run without any
 * S3 dependency. Paths are mapped as:
 * <pre>
 *   {localBaseDir}/{bucket}/{path}          object bytes
 *   {localBaseDir}/{bucket}/{path}.meta     content type, ETag, user metadata
 *   {localBaseDir}/.multipart/{uploadId}/   staged parts
 * </pre>
 * ETags follow S3's scheme: MD5 of the content for single puts, MD5 of the part digests
 * suffixed with the part count for multipart objects.
 */
@Service
@ConditionalOnProperty(prefix = "cloudstorage", name = "store", havingValue = "local")
public class LocalFsObjectStoreClient implements ObjectStoreClient {
    private static final Logger log = LoggerFactory.getLogger(LocalFsObjectStoreClient.class);

    private final Path base;
    private final Path objectRoot;
    private final Path stagingRoot;
    private final ConcurrentHashMap<String, Object> pathMonitors = new ConcurrentHashMap<>();

    public LocalFsObjectStoreClient(CloudStorageProperties props) {
        this.base = Path.of(props.getLocalBaseDir()).toAbsolutePath().normalize();
        this.objectRoot = base.resolve(props.getBucket());
        this.stagingRoot = base.resolve(".multipart");
        try {
            Files.createDirectories(objectRoot);
            Files.createDirectories(stagingRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create localBaseDir=" + base, e);
        }
        log.info("Using LOCAL object store: baseDir={}", base);
    }

    private Path pathFor(String path) {
        // Prevent path traversal by normalizing and verifying base prefix.
        Path p = objectRoot.resolve(path).normalize();
        if (!p.startsWith(objectRoot) || p.equals(objectRoot)) {
            throw new ObjectStoreException("Illegal key (path traversal): " + path, 400, false);
        }
        return p;
    }

    private Path metaPathFor(String path) {
        Path p = pathFor(path);
        return p.resolveSibling(p.getFileName().toString() + ".meta");
    }

    private Path stagingDir(ObjectStoreModels.MultipartSession session) {
        Path dir = stagingRoot.resolve(session.uploadId()).normalize();
        if (!dir.startsWith(stagingRoot)) {
            throw new ObjectStoreException("Illegal upload id: " + session.uploadId(), 400, false);
        }
        return dir;
    }

    private Object monitor(String path) {
        return pathMonitors.computeIfAbsent(path, k -> new Object());
    }

    @Override
    public ObjectStoreModels.MultipartSession initiateMultipart(String path, String contentType, Map<String, String> userMetadata) {
        pathFor(path);
        ObjectStoreModels.MultipartSession session = new ObjectStoreModels.MultipartSession(path, UUID.randomUUID().toString());
        try {
            Path dir = stagingDir(session);
            Files.createDirectories(dir);
            writeProperties(dir.resolve("upload.meta"), path, contentType, null, userMetadata);
            return session;
        } catch (IOException e) {
            throw new ObjectStoreException("Local initiateMultipart failed for " + path, e, 0, false);
        }
    }

    @Override
    public String uploadPart(ObjectStoreModels.MultipartSession session, int partNumber, byte[] bytes) {
        Path dir = stagingDir(session);
        if (!Files.isDirectory(dir)) {
            throw new ObjectStoreException("No such upload: " + session.uploadId(), 404, false);
        }
        try {
            Path tmp = Files.createTempFile(dir, "part-", ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, dir.resolve(partFileName(partNumber)), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return md5Hex(bytes);
        } catch (NoSuchFileException e) {
            throw new ObjectStoreException("No such upload: " + session.uploadId(), e, 404, false);
        } catch (IOException e) {
            throw new ObjectStoreException("Local uploadPart failed for " + session.path(), e, 0, false);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor completeMultipart(ObjectStoreModels.MultipartSession session,
                                                                List<ObjectStoreModels.CompletedPart> parts) {
        Path dir = stagingDir(session);
        if (!Files.isDirectory(dir)) {
            throw new ObjectStoreException("No such upload: " + session.uploadId(), 404, false);
        }
        try {
            Properties uploadMeta = readProperties(dir.resolve("upload.meta"));
            Path dst = pathFor(session.path());
            Files.createDirectories(dst.getParent());
            Path tmp = Files.createTempFile(dst.getParent(), "cs-", ".tmp");

            MessageDigest etagDigest = md5();
            int previous = 0;
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.TRUNCATE_EXISTING)) {
                for (ObjectStoreModels.CompletedPart part : parts) {
                    if (part.partNumber() <= previous) {
                        throw new ObjectStoreException("Parts must be in ascending order: " + part.partNumber(), 400, false);
                    }
                    previous = part.partNumber();
                    Path partFile = dir.resolve(partFileName(part.partNumber()));
                    if (!Files.exists(partFile)) {
                        throw new ObjectStoreException("Invalid part " + part.partNumber() + " for " + session.path(), 400, false);
                    }
                    byte[] bytes = Files.readAllBytes(partFile);
                    String actual = md5Hex(bytes);
                    if (!actual.equals(part.eTag())) {
                        throw new ObjectStoreException("ETag mismatch for part " + part.partNumber(), 400, false);
                    }
                    etagDigest.update(HexFormat.of().parseHex(actual));
                    out.write(bytes);
                }
            } catch (ObjectStoreException e) {
                Files.deleteIfExists(tmp);
                throw e;
            }

            String eTag = HexFormat.of().formatHex(etagDigest.digest()) + "-" + parts.size();
            synchronized (monitor(session.path())) {
                Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                writeProperties(metaPathFor(session.path()), null, uploadMeta.getProperty("contentType"), eTag, userMetadataOf(uploadMeta));
            }
            deleteRecursively(dir);
            return new ObjectStoreModels.ObjectDescriptor(session.path(), eTag, null);
        } catch (IOException e) {
            throw new ObjectStoreException("Local completeMultipart failed for " + session.path(), e, 0, false);
        }
    }

    @Override
    public void abortMultipart(ObjectStoreModels.MultipartSession session) {
        try {
            deleteRecursively(stagingDir(session));
        } catch (IOException e) {
            throw new ObjectStoreException("Local abortMultipart failed for " + session.path(), e, 0, false);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor putSingle(String path, byte[] bytes, String contentType, Map<String, String> userMetadata) {
        synchronized (monitor(path)) {
            return write(path, bytes, contentType, userMetadata);
        }
    }

    @Override
    public ObjectStoreModels.ObjectDescriptor putConditional(String path, byte[] bytes, String expectedETag) {
        synchronized (monitor(path)) {
            Optional<ObjectStoreModels.ObjectMetadata> current = getMetadata(path);
            boolean matches = expectedETag == null
                    ? current.isEmpty()
                    : current.isPresent() && expectedETag.equals(current.get().eTag());
            if (!matches) {
                throw new ObjectStoreException("Precondition failed for " + path, ObjectStoreException.PRECONDITION_FAILED, false);
            }
            return write(path, bytes, current.map(ObjectStoreModels.ObjectMetadata::contentType).orElse(null),
                    current.map(ObjectStoreModels.ObjectMetadata::userMetadata).orElse(Map.of()));
        }
    }

    @Override
    public Optional<ObjectStoreModels.ObjectMetadata> getMetadata(String path) {
        try {
            Path p = pathFor(path);
            if (!Files.exists(p)) return Optional.empty();
            long len = Files.size(p);
            Instant lm = Files.getLastModifiedTime(p).toInstant();
            Properties meta = readProperties(metaPathFor(path));
            return Optional.of(new ObjectStoreModels.ObjectMetadata(
                    path, len, meta.getProperty("eTag"), null, meta.getProperty("contentType"), lm, userMetadataOf(meta)));
        } catch (IOException e) {
            throw new ObjectStoreException("Local head failed for " + path, e, 0, false);
        }
    }

    @Override
    public byte[] get(String path) {
        try {
            return Files.readAllBytes(pathFor(path));
        } catch (NoSuchFileException e) {
            throw new ObjectStoreException("No such object: " + path, e, 404, false);
        } catch (IOException e) {
            throw new ObjectStoreException("Local get failed for " + path, e, 0, false);
        }
    }

    @Override
    public void delete(String path) {
        synchronized (monitor(path)) {
            try {
                Files.deleteIfExists(pathFor(path));
                Files.deleteIfExists(metaPathFor(path));
            } catch (IOException e) {
                throw new ObjectStoreException("Local delete failed for " + path, e, 0, false);
            }
        }
    }

    private ObjectStoreModels.ObjectDescriptor write(String path, byte[] bytes, String contentType, Map<String, String> userMetadata) {
        try {
            Path dst = pathFor(path);
            Files.createDirectories(dst.getParent());
            Path tmp = Files.createTempFile(dst.getParent(), "cs-", ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            String eTag = md5Hex(bytes);
            writeProperties(metaPathFor(path), null, contentType, eTag, userMetadata);
            return new ObjectStoreModels.ObjectDescriptor(path, eTag, null);
        } catch (IOException e) {
            throw new ObjectStoreException("Local put failed for " + path, e, 0, false);
        }
    }

    private static String partFileName(int partNumber) {
        return "part-" + String.format("%05d", partNumber);
    }

    private static void writeProperties(Path file, String path, String contentType, String eTag,
                                        Map<String, String> userMetadata) throws IOException {
        Properties props = new Properties();
        if (path != null) props.setProperty("path", path);
        if (contentType != null) props.setProperty("contentType", contentType);
        if (eTag != null) props.setProperty("eTag", eTag);
        if (userMetadata != null) {
            for (var ent : userMetadata.entrySet()) {
                if (ent.getKey() != null && ent.getValue() != null) {
                    props.setProperty("meta." + ent.getKey(), ent.getValue());
                }
            }
        }
        Files.createDirectories(file.getParent());
        try (OutputStream out = Files.newOutputStream(file)) {
            props.store(out, "cloudstorage local object metadata");
        }
    }

    private static Properties readProperties(Path file) throws IOException {
        Properties props = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            }
        }
        return props;
    }

    private static Map<String, String> userMetadataOf(Properties props) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith("meta.")) {
                out.put(name.substring("meta.".length()), props.getProperty(name));
            }
        }
        return out;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String md5Hex(byte[] bytes) {
        return HexFormat.of().formatHex(md5().digest(bytes));
    }
}
