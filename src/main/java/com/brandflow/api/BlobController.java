package com.brandflow.api;

import com.brandflow.blob.BlobListing;
import com.brandflow.blob.BlobStore;
import com.brandflow.blob.BlobUrlSigner;
import com.brandflow.blob.StoredBlob;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;

@RestController
@RequestMapping("/api/blobs")
public class BlobController {

    private final BlobStore blobStore;
    private final BlobUrlSigner signer;
    private final Clock clock;

    public BlobController(BlobStore blobStore, BlobUrlSigner signer, Clock clock) {
        this.blobStore = blobStore;
        this.signer = signer;
        this.clock = clock;
    }

    @GetMapping
    public BlobListing list(@RequestParam(value = "prefix", required = false) String prefix) {
        String normalized = prefix == null ? "" : prefix;
        return new BlobListing(normalized, blobStore.list(normalized));
    }

    @GetMapping("/{*key}")
    public ResponseEntity<byte[]> read(@PathVariable("key") String rawKey,
                                       @RequestParam(value = "expires", required = false) Long expires,
                                       @RequestParam(value = "signature", required = false) String signature) {
        String key = rawKey.startsWith("/") ? rawKey.substring(1) : rawKey;
        if (key.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Blob key is required.");
        }
        if (expires == null || !signer.verify(key, expires, signature, clock.instant())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Missing, invalid or expired signature.");
        }
        StoredBlob blob = blobStore.get(key)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Blob not found."));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(blob.contentType()))
                .cacheControl(CacheControl.noStore())
                .body(blob.bytes());
    }
}
