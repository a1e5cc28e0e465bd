package com.brandflow.workflow.service;

import com.brandflow.workflow.exception.GenerationInProgressException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Allows at most one generation run per session id inside this process. Cross-process
 * writers are still caught by the version check on write-back.
 */
@Component
public class SessionRunGuard {

    private final Set<String> running = ConcurrentHashMap.newKeySet();

    /**
     * Starts {@code run} unless another run for the session is in flight; the slot is freed
     * when the returned future completes either way.
     *
     * @throws GenerationInProgressException when a run is already in flight
     */
    public <T> CompletableFuture<T> runExclusive(String sessionId, Supplier<CompletableFuture<T>> run) {
        if (!running.add(sessionId)) {
            throw new GenerationInProgressException("A generation run for session " + sessionId + " is already in progress.");
        }
        CompletableFuture<T> future;
        try {
            future = run.get();
        } catch (RuntimeException ex) {
            running.remove(sessionId);
            throw ex;
        }
        return future.whenComplete((value, error) -> running.remove(sessionId));
    }

    public boolean isRunning(String sessionId) {
        return running.contains(sessionId);
    }
}
