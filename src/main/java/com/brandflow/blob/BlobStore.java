package com.brandflow.blob;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable object storage for generated artifacts.
 */
public interface BlobStore {

    /**
     * Writes the object in full or not at all and returns a time-bounded read URL for it.
     *
     * @throws com.brandflow.workflow.exception.BlobStorageException when the write fails
     */
    BlobObject put(String key, byte[] bytes, String contentType, Map<String, String> metadata);

    Optional<StoredBlob> get(String key);

    List<BlobEntry> list(String prefix);

    PresignedUrl presignedReadUrl(String key, Duration ttl);

    /**
     * Removes every object whose key starts with {@code prefix}, which must not be blank.
     *
     * @return the number of objects removed
     */
    int deletePrefix(String prefix);
}
