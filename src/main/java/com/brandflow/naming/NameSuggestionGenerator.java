package com.brandflow.naming;

import com.brandflow.workflow.model.NameSuggestion;

import java.util.List;

/**
 * Produces business name candidates. Implementations may return fewer than requested but
 * never a name from {@link NamingRequest#forbiddenNames()}.
 */
public interface NameSuggestionGenerator {

    List<NameSuggestion> generate(NamingRequest request);
}
