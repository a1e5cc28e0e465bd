package com.brandflow.blob;

import com.brandflow.workflow.exception.BlobStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link BlobStore} on the local filesystem. Object bytes live at {@code <root>/<key>}; content
 * type and metadata live in a {@code <key>.meta.json} sidecar.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    static final String META_SUFFIX = ".meta.json";
    private static final String CONTENT_TYPE_FIELD = "contentType";
    private static final TypeReference<Map<String, String>> META_TYPE = new TypeReference<>() {
    };

    private final Path root;
    private final BlobUrlSigner signer;
    private final Duration readUrlTtl;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileSystemBlobStore(String root, BlobUrlSigner signer, Duration readUrlTtl,
                               ObjectMapper objectMapper, Clock clock) {
        String rootValue = StringUtils.hasText(root) ? root : System.getProperty("user.dir");
        this.root = Paths.get(rootValue).toAbsolutePath().normalize();
        this.signer = signer;
        this.readUrlTtl = readUrlTtl;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public BlobObject put(String key, byte[] bytes, String contentType, Map<String, String> metadata) {
        Path target = resolveKey(key);
        if (target.getFileName().toString().endsWith(META_SUFFIX)) {
            throw new BlobStorageException("Key may not end with " + META_SUFFIX + ": " + key);
        }
        String type = StringUtils.hasText(contentType) ? contentType : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        Map<String, String> sidecar = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        sidecar.put(CONTENT_TYPE_FIELD, type);
        try {
            Files.createDirectories(target.getParent());
            writeAtomically(sidecarOf(target), objectMapper.writeValueAsBytes(sidecar));
            writeAtomically(target, bytes);
        } catch (IOException ex) {
            throw new BlobStorageException("Failed to write blob " + key, ex);
        }
        PresignedUrl url = presignedReadUrl(key, readUrlTtl);
        log.debug("Stored blob {} ({} bytes, {})", key, bytes.length, type);
        return new BlobObject(key, url.url(), url.expiresAt(), bytes.length, type);
    }

    @Override
    public Optional<StoredBlob> get(String key) {
        Path target = resolveKey(key);
        if (!Files.isRegularFile(target) || target.getFileName().toString().endsWith(META_SUFFIX)) {
            return Optional.empty();
        }
        try {
            Map<String, String> metadata = new LinkedHashMap<>(readSidecar(target));
            String contentType = metadata.remove(CONTENT_TYPE_FIELD);
            return Optional.of(new StoredBlob(
                    toKey(target),
                    Files.readAllBytes(target),
                    contentType != null ? contentType : MediaType.APPLICATION_OCTET_STREAM_VALUE,
                    Map.copyOf(metadata),
                    Files.getLastModifiedTime(target).toInstant()));
        } catch (IOException ex) {
            throw new BlobStorageException("Failed to read blob " + key, ex);
        }
    }

    @Override
    public List<BlobEntry> list(String prefix) {
        String normalizedPrefix = normalizePrefix(prefix);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().endsWith(META_SUFFIX))
                    .filter(path -> !path.getFileName().toString().startsWith("."))
                    .map(this::toEntry)
                    .filter(entry -> entry.key().startsWith(normalizedPrefix))
                    .sorted(Comparator.comparing(BlobEntry::key))
                    .toList();
        } catch (IOException ex) {
            throw new BlobStorageException("Failed to list blobs under " + normalizedPrefix, ex);
        }
    }

    @Override
    public PresignedUrl presignedReadUrl(String key, Duration ttl) {
        resolveKey(key);
        return signer.presign(key, clock.instant(), ttl);
    }

    @Override
    public int deletePrefix(String prefix) {
        String normalizedPrefix = normalizePrefix(prefix);
        if (!StringUtils.hasText(normalizedPrefix)) {
            throw new BlobStorageException("Refusing to delete blobs without a prefix.");
        }
        int deleted = 0;
        for (BlobEntry entry : list(normalizedPrefix)) {
            Path target = resolveKey(entry.key());
            try {
                Files.deleteIfExists(sidecarOf(target));
                if (Files.deleteIfExists(target)) {
                    deleted++;
                }
                pruneEmptyDirectories(target.getParent());
            } catch (IOException ex) {
                throw new BlobStorageException("Failed to delete blob " + entry.key(), ex);
            }
        }
        log.debug("Deleted {} blobs under {}", deleted, normalizedPrefix);
        return deleted;
    }

    // stops below the top-level namespace directories
    private void pruneEmptyDirectories(Path dir) throws IOException {
        Path current = dir;
        while (current != null && current.startsWith(root) && current.getNameCount() > root.getNameCount() + 1) {
            try (Stream<Path> children = Files.list(current)) {
                if (children.findAny().isPresent()) {
                    return;
                }
            }
            Files.deleteIfExists(current);
            current = current.getParent();
        }
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                log.debug("Atomic move unsupported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Map<String, String> readSidecar(Path target) throws IOException {
        Path sidecar = sidecarOf(target);
        if (!Files.isRegularFile(sidecar)) {
            return Map.of();
        }
        return objectMapper.readValue(sidecar.toFile(), META_TYPE);
    }

    private Path resolveKey(String key) {
        if (!StringUtils.hasText(key)) {
            throw new BlobStorageException("Blob key is required.");
        }
        Path target = root.resolve(key.replace("\\", "/").replaceAll("^/+", "")).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new BlobStorageException("Invalid blob key: " + key);
        }
        return target;
    }

    private static String normalizePrefix(String prefix) {
        return prefix == null ? "" : prefix.replace("\\", "/").replaceAll("^/+", "");
    }

    private static Path sidecarOf(Path target) {
        return target.resolveSibling(target.getFileName() + META_SUFFIX);
    }

    private BlobEntry toEntry(Path path) {
        try {
            return new BlobEntry(toKey(path), Files.size(path), Files.getLastModifiedTime(path).toInstant());
        } catch (IOException ex) {
            log.warn("Could not stat blob {}: {}", path, ex.getMessage());
            return new BlobEntry(toKey(path), 0L, Instant.EPOCH);
        }
    }

    private String toKey(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace("\\", "/");
    }
}
