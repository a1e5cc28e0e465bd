package com.brandflow.workflow.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the session's append-only execution log.
 */
public record AgentExecutionRecord(
        AgentType agent,
        String tool,
        ExecutionStatus status,
        long latencyMs,
        @Nullable String errorMessage,
        Map<String, String> metadata,
        Instant timestamp
) {

    public AgentExecutionRecord {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        latencyMs = Math.max(latencyMs, 0L);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AgentExecutionRecord success(AgentType agent, String tool, long latencyMs,
                                               Map<String, String> metadata, Instant timestamp) {
        return new AgentExecutionRecord(agent, tool, ExecutionStatus.SUCCESS, latencyMs, null, metadata, timestamp);
    }

    public static AgentExecutionRecord error(AgentType agent, String tool, long latencyMs,
                                             String errorMessage, Instant timestamp) {
        return new AgentExecutionRecord(agent, tool, ExecutionStatus.ERROR, latencyMs, errorMessage, Map.of(), timestamp);
    }
}
