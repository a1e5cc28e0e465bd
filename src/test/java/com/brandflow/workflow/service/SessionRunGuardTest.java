package com.brandflow.workflow.service;

import com.brandflow.workflow.exception.GenerationInProgressException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class SessionRunGuardTest {

    private final SessionRunGuard guard = new SessionRunGuard();

    @Test
    void testSecondRunIsRejectedUntilFirstCompletes() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> run = guard.runExclusive("s1", () -> pending);

        assertTrue(guard.isRunning("s1"));
        assertThrows(GenerationInProgressException.class,
                () -> guard.runExclusive("s1", () -> CompletableFuture.completedFuture("again")));

        pending.complete("done");
        assertEquals("done", run.join());
        assertFalse(guard.isRunning("s1"));
        assertEquals("next", guard.runExclusive("s1", () -> CompletableFuture.completedFuture("next")).join());
    }

    @Test
    void testOtherSessionsAreIndependent() {
        guard.runExclusive("s1", CompletableFuture::new);

        assertEquals("ok", guard.runExclusive("s2", () -> CompletableFuture.completedFuture("ok")).join());
    }

    @Test
    void testSlotIsFreedOnFailure() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        guard.runExclusive("s1", () -> pending);
        pending.completeExceptionally(new IllegalStateException("boom"));
        assertFalse(guard.isRunning("s1"));

        assertThrows(IllegalArgumentException.class, () -> guard.runExclusive("s1", () -> {
            throw new IllegalArgumentException("bad input");
        }));
        assertFalse(guard.isRunning("s1"));
    }
}
