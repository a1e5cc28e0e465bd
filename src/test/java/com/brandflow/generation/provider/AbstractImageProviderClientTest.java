package com.brandflow.generation.provider;

import com.brandflow.config.BrandFlowProperties.ProviderConfig;
import com.brandflow.generation.GenerationMetricsService;
import com.brandflow.workflow.model.WorkflowStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class AbstractImageProviderClientTest {

    private ExecutorService executor;
    private ProviderConfig config;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        config = new ProviderConfig();
        config.setMaxAttempts(3);
        config.setBackoffBase(Duration.ofMillis(1));
        config.setAttemptTimeout(Duration.ofMillis(200));
        config.setMaxPromptLength(200);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testRateLimitIsRetriedUpToMaxAttempts() {
        ScriptedClient client = client();
        for (int i = 0; i < 5; i++) {
            client.script.add(() -> { throw error(ProviderErrorType.RATE_LIMIT); });
        }

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertFalse(result.success());
        assertEquals(ProviderErrorType.RATE_LIMIT, result.errorType());
        assertEquals(3, result.attempts());
        assertEquals(3, client.prompts.size());
    }

    @Test
    void testInvalidPromptIsTerminalImmediately() {
        ScriptedClient client = client();
        client.script.add(() -> { throw error(ProviderErrorType.INVALID_PROMPT); });

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertFalse(result.success());
        assertEquals(ProviderErrorType.INVALID_PROMPT, result.errorType());
        assertEquals(1, result.attempts());
        assertEquals(1, client.prompts.size());
    }

    @Test
    void testRecoversAfterTransientServerError() {
        ScriptedClient client = client();
        client.script.add(() -> { throw error(ProviderErrorType.SERVER_ERROR); });
        client.script.add(() -> new ProviderResponse("https://img.example/1.png", "revised"));

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertTrue(result.success());
        assertEquals("https://img.example/1.png", result.imageUrl());
        assertEquals("revised", result.revisedPrompt());
        assertEquals(2, result.attempts());
    }

    @Test
    void testSlowAttemptTimesOutAndIsRetried() {
        ScriptedClient client = client();
        client.script.add(() -> {
            sleep(1_000);
            return new ProviderResponse("https://img.example/late.png", null);
        });
        client.script.add(() -> new ProviderResponse("https://img.example/fast.png", null));

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertTrue(result.success());
        assertEquals("https://img.example/fast.png", result.imageUrl());
        assertEquals(2, result.attempts());
    }

    @Test
    void testEveryAttemptTimingOutReportsTimeout() {
        ScriptedClient client = client();
        for (int i = 0; i < 3; i++) {
            client.script.add(() -> {
                sleep(1_000);
                return new ProviderResponse("https://img.example/late.png", null);
            });
        }

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertFalse(result.success());
        assertEquals(ProviderErrorType.TIMEOUT, result.errorType());
        assertEquals(3, result.attempts());
    }

    @Test
    void testUnclassifiedFailureCountsAsServerError() {
        config.setMaxAttempts(1);
        ScriptedClient client = client();
        client.script.add(() -> { throw new IllegalStateException("boom"); });

        ProviderResult result = client.generate(spec("modern sign")).join();

        assertEquals(ProviderErrorType.SERVER_ERROR, result.errorType());
    }

    @Test
    void testBackoffDoublesPerAttempt() {
        config.setBackoffBase(Duration.ofMillis(500));
        ScriptedClient client = client();

        assertEquals(Duration.ofMillis(500), client.backoffDelay(0));
        assertEquals(Duration.ofMillis(1000), client.backoffDelay(1));
        assertEquals(Duration.ofMillis(2000), client.backoffDelay(2));
    }

    @Test
    void testPromptIsSanitizedBeforeSending() {
        ScriptedClient client = client();
        client.script.add(() -> new ProviderResponse("https://img.example/1.png", null));

        ProviderResult result = client.generate(spec("Bar sign with gore")).join();

        assertTrue(result.success());
        assertEquals("Bar sign with Safe.", client.prompts.get(0));
        assertEquals("Bar sign with Safe.", result.sanitizedPrompt());
    }

    @Test
    void testPromptEmptyAfterSanitationNeverReachesProvider() {
        ScriptedClient client = client();

        ProviderResult result = client.generate(spec("gore")).join();

        assertFalse(result.success());
        assertEquals(ProviderErrorType.INVALID_PROMPT, result.errorType());
        assertEquals(0, result.attempts());
        assertTrue(client.prompts.isEmpty());
    }

    private ScriptedClient client() {
        return new ScriptedClient(config, executor);
    }

    private static PromptSpec spec(String prompt) {
        return PromptSpec.of("session-1", WorkflowStep.SIGNAGE, "modern", prompt);
    }

    private static ProviderException error(ProviderErrorType type) {
        return new ProviderException("scripted", type, type.value());
    }

    private static void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    static class ScriptedClient extends AbstractImageProviderClient {

        final Deque<Supplier<ProviderResponse>> script = new ArrayDeque<>();
        final List<String> prompts = new ArrayList<>();

        ScriptedClient(ProviderConfig config, ExecutorService executor) {
            super("scripted", config, new PromptSanitizer(List.of("gore"), "Safe."), executor,
                    new GenerationMetricsService());
        }

        @Override
        protected ProviderResponse invoke(String sanitizedPrompt, PromptSpec spec) {
            Supplier<ProviderResponse> next;
            synchronized (this) {
                prompts.add(sanitizedPrompt);
                next = script.poll();
            }
            if (next == null) {
                throw new ProviderException("scripted", ProviderErrorType.SERVER_ERROR, "script exhausted");
            }
            return next.get();
        }
    }
}
