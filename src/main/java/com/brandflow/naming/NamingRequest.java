package com.brandflow.naming;

import com.brandflow.workflow.model.AnalysisSummary;
import com.brandflow.workflow.model.BusinessProfile;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Everything one generator call may use. {@code forbiddenNames} are lower-cased names that
 * must not be suggested again for this session.
 */
public record NamingRequest(
        String sessionId,
        BusinessProfile profile,
        @Nullable AnalysisSummary analysis,
        Set<String> forbiddenNames,
        int count,
        int round
) {

    public NamingRequest {
        forbiddenNames = forbiddenNames == null ? Set.of() : Set.copyOf(forbiddenNames);
    }
}
