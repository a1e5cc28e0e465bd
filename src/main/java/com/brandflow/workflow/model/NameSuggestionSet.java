package com.brandflow.workflow.model;

import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Name suggestions of the naming step. {@code forbiddenNames} holds every name offered in
 * earlier rounds of this session, lower-cased, so regeneration never repeats itself.
 */
public record NameSuggestionSet(
        List<NameSuggestion> suggestions,
        @Nullable String selectedName,
        int regenerationCount,
        Set<String> forbiddenNames
) {

    public NameSuggestionSet {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        forbiddenNames = forbiddenNames == null ? Set.of() : Set.copyOf(forbiddenNames);
    }

    public static NameSuggestionSet initial(List<NameSuggestion> suggestions) {
        return new NameSuggestionSet(suggestions, null, 0, Set.of());
    }

    public Optional<NameSuggestion> find(@Nullable String name) {
        if (name == null) {
            return Optional.empty();
        }
        return suggestions.stream().filter(suggestion -> suggestion.name().equals(name)).findFirst();
    }

    public NameSuggestionSet regenerated(List<NameSuggestion> fresh) {
        Set<String> forbidden = new LinkedHashSet<>(forbiddenNames);
        suggestions.forEach(suggestion -> forbidden.add(suggestion.name().toLowerCase(Locale.ROOT)));
        return new NameSuggestionSet(fresh, null, regenerationCount + 1, forbidden);
    }

    public NameSuggestionSet withSelection(String name) {
        return new NameSuggestionSet(suggestions, name, regenerationCount, forbiddenNames);
    }
}
