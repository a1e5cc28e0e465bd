package com.brandflow.naming;

import com.brandflow.workflow.model.Industry;
import com.brandflow.workflow.model.NameSuggestion;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic names built from the profile and the round number. Used offline and as the
 * fallback of {@link ChatNameSuggestionGenerator}.
 */
public class StubNameSuggestionGenerator implements NameSuggestionGenerator {

    private static final Map<Industry, List<String>> WORDS = new EnumMap<>(Map.of(
            Industry.RESTAURANT, List.of("Table", "Hearth", "Spoon", "Harvest", "Bowl", "Garden", "Ember", "Pantry"),
            Industry.RETAIL, List.of("Market", "Corner", "Shelf", "Basket", "Arcade", "Parcel", "Goods", "Bazaar"),
            Industry.SERVICE, List.of("Hands", "Bridge", "Anchor", "Compass", "Helper", "Circle", "Keystone", "Harbor"),
            Industry.HEALTHCARE, List.of("Care", "Vital", "Wellspring", "Clinic", "Balance", "Remedy", "Pulse", "Haven"),
            Industry.EDUCATION, List.of("Academy", "Lantern", "Scholar", "Ladder", "Quill", "Atlas", "Sprout", "Insight"),
            Industry.TECHNOLOGY, List.of("Labs", "Pixel", "Circuit", "Vector", "Nimbus", "Kernel", "Signal", "Orbit"),
            Industry.MANUFACTURING, List.of("Works", "Forge", "Foundry", "Mill", "Press", "Anvil", "Assembly", "Lathe"),
            Industry.CONSTRUCTION, List.of("Build", "Beam", "Cornerstone", "Frame", "Mason", "Summit", "Pillar", "Level"),
            Industry.FINANCE, List.of("Capital", "Trust", "Ledger", "Crest", "Meridian", "Sterling", "Vault", "Harbor")));

    private static final List<String> GENERIC_WORDS = List.of("Studio", "Collective", "House", "Point", "Hub", "Place");
    private static final List<String> PATTERNS = List.of("%s %s", "The %2$s %1$s", "%2$s & Co.", "%s %s House");

    @Override
    public List<NameSuggestion> generate(NamingRequest request) {
        List<String> words = WORDS.getOrDefault(request.profile().industry(), GENERIC_WORDS);
        String region = capitalize(request.profile().region().key());
        Set<String> seen = new LinkedHashSet<>(request.forbiddenNames());
        List<NameSuggestion> result = new ArrayList<>();
        int offset = request.round() * request.count();
        int candidates = words.size() * PATTERNS.size();
        for (int i = 0; i < candidates && result.size() < request.count(); i++) {
            int index = offset + i;
            String word = words.get(index % words.size());
            String pattern = PATTERNS.get((index / words.size()) % PATTERNS.size());
            String name = String.format(Locale.ROOT, pattern, region, word).trim();
            if (seen.add(name.toLowerCase(Locale.ROOT))) {
                result.add(new NameSuggestion(name, describe(request, word)));
            }
        }
        return List.copyOf(result);
    }

    private static String describe(NamingRequest request, String word) {
        String base = "A " + request.profile().size().key() + " " + request.profile().industry().key()
                + " business in " + capitalize(request.profile().region().key()) + ", built around the idea of '"
                + word.toLowerCase(Locale.ROOT) + "'.";
        return StringUtils.hasText(request.profile().description()) ? base + " " + request.profile().description() : base;
    }

    private static String capitalize(String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
