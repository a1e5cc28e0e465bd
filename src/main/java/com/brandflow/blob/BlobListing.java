package com.brandflow.blob;

import java.util.List;

public record BlobListing(
        String prefix,
        List<BlobEntry> entries
) {
}
