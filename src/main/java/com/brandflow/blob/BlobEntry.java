package com.brandflow.blob;

import java.time.Instant;

public record BlobEntry(
        String key,
        long size,
        Instant lastModified
) {
}
