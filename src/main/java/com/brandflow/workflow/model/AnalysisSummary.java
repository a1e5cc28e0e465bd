package com.brandflow.workflow.model;

import java.time.Instant;
import java.util.List;

public record AnalysisSummary(String summary, double score, List<String> insights, Instant recordedAt) {

    public AnalysisSummary {
        insights = insights == null ? List.of() : List.copyOf(insights);
    }
}
