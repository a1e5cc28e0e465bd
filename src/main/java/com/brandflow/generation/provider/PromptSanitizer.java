package com.brandflow.generation.provider;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips deny-listed terms, truncates to the provider limit and appends the mandatory
 * safety qualifier. The result never exceeds the provider limit.
 */
public class PromptSanitizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern denyPattern;
    private final String safetyQualifier;

    public PromptSanitizer(List<String> denyList, String safetyQualifier) {
        List<String> terms = denyList == null ? List.of() : denyList.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList();
        this.denyPattern = terms.isEmpty() ? null : Pattern.compile(
                terms.stream().map(Pattern::quote).collect(Collectors.joining("|", "(?<![\\p{L}\\p{N}])(?:", ")(?![\\p{L}\\p{N}])")),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.safetyQualifier = safetyQualifier == null ? "" : safetyQualifier.trim();
    }

    /**
     * @throws IllegalArgumentException when nothing usable is left of the prompt
     */
    public String sanitize(String rawPrompt, int maxLength) {
        String cleaned = rawPrompt == null ? "" : rawPrompt;
        if (denyPattern != null) {
            cleaned = denyPattern.matcher(cleaned).replaceAll(" ");
        }
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("Prompt is empty after sanitation.");
        }
        if (safetyQualifier.isEmpty()) {
            return truncate(cleaned, maxLength);
        }
        int budget = maxLength - safetyQualifier.length() - 1;
        if (budget <= 0) {
            return truncate(safetyQualifier, maxLength);
        }
        return truncate(cleaned, budget) + " " + safetyQualifier;
    }

    private String truncate(String value, int maxLength) {
        if (maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength).trim();
    }
}
