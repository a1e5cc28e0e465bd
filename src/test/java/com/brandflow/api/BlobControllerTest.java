package com.brandflow.api;

import com.brandflow.blob.BlobObject;
import com.brandflow.blob.BlobUrlSigner;
import com.brandflow.blob.FileSystemBlobStore;
import com.brandflow.support.MutableClock;
import com.brandflow.support.TestObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class BlobControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MockMvc mockMvc;
    private MutableClock clock;
    private FileSystemBlobStore store;
    private BlobUrlSigner signer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        signer = new BlobUrlSigner("controller-key", "http://localhost");
        store = new FileSystemBlobStore(tempDir.toString(), signer, Duration.ofHours(1), TestObjectMappers.create(), clock);
        mockMvc = MockMvcBuilders.standaloneSetup(new BlobController(store, signer, clock))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    void testReadWithPresignedUrl() throws Exception {
        BlobObject stored = store.put("signage/s1/modern.png", new byte[]{7, 8, 9}, "image/png", Map.of());

        mockMvc.perform(get(URI.create(stored.url())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(new byte[]{7, 8, 9}))
                .andExpect(header().string("Cache-Control", "no-store"));
    }

    @Test
    void testTamperedSignatureIsForbidden() throws Exception {
        BlobObject stored = store.put("signage/s1/modern.png", new byte[]{1}, "image/png", Map.of());
        String otherKeyUrl = stored.url().replace("signage/s1/modern.png", "signage/s1/classic.png");

        mockMvc.perform(get(URI.create(otherKeyUrl)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        mockMvc.perform(get("/api/blobs/signage/s1/modern.png"))
                .andExpect(status().isForbidden());
    }

    @Test
    void testExpiredUrlIsForbidden() throws Exception {
        BlobObject stored = store.put("signage/s1/modern.png", new byte[]{1}, "image/png", Map.of());
        clock.advance(Duration.ofHours(2));

        mockMvc.perform(get(URI.create(stored.url())))
                .andExpect(status().isForbidden());
    }

    @Test
    void testSignedUrlForMissingBlob() throws Exception {
        String url = signer.presign("interior/s1/none.png", NOW, Duration.ofMinutes(5)).url();

        mockMvc.perform(get(URI.create(url)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void testListByPrefix() throws Exception {
        store.put("signage/s1/modern.png", new byte[]{1}, "image/png", Map.of());
        store.put("signage/s1/classic.png", new byte[]{1, 2}, "image/png", Map.of());
        store.put("interior/s1/cozy.png", new byte[]{1}, "image/png", Map.of());

        mockMvc.perform(get("/api/blobs").param("prefix", "signage/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix").value("signage/"))
                .andExpect(jsonPath("$.entries.length()").value(2))
                .andExpect(jsonPath("$.entries[0].key").value("signage/s1/classic.png"))
                .andExpect(jsonPath("$.entries[0].size").value(2));
    }
}
