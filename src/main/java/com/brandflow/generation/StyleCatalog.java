package com.brandflow.generation;

import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.Industry;
import com.brandflow.workflow.model.WorkflowStep;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Known styles per visual step and the order in which they are offered per industry.
 */
public class StyleCatalog {

    private static final Map<WorkflowStep, List<String>> KNOWN_STYLES = Map.of(
            WorkflowStep.SIGNAGE, List.of("modern", "classic", "vibrant", "minimal"),
            WorkflowStep.INTERIOR, List.of("modern", "cozy", "luxury", "industrial"));

    private static final Map<Industry, List<String>> SIGNAGE_PRECEDENCE = new EnumMap<>(Map.of(
            Industry.RESTAURANT, List.of("vibrant", "modern", "classic"),
            Industry.RETAIL, List.of("modern", "vibrant", "minimal"),
            Industry.SERVICE, List.of("modern", "minimal", "classic"),
            Industry.HEALTHCARE, List.of("minimal", "modern", "classic"),
            Industry.EDUCATION, List.of("classic", "vibrant", "modern"),
            Industry.TECHNOLOGY, List.of("modern", "minimal", "vibrant"),
            Industry.MANUFACTURING, List.of("classic", "modern", "minimal"),
            Industry.CONSTRUCTION, List.of("classic", "modern", "minimal"),
            Industry.FINANCE, List.of("classic", "minimal", "modern")));

    private static final Map<Industry, List<String>> INTERIOR_PRECEDENCE = new EnumMap<>(Map.of(
            Industry.RESTAURANT, List.of("cozy", "modern", "luxury"),
            Industry.RETAIL, List.of("modern", "luxury", "industrial"),
            Industry.SERVICE, List.of("modern", "cozy", "luxury"),
            Industry.HEALTHCARE, List.of("modern", "cozy"),
            Industry.EDUCATION, List.of("cozy", "modern"),
            Industry.TECHNOLOGY, List.of("industrial", "modern"),
            Industry.MANUFACTURING, List.of("industrial", "modern"),
            Industry.CONSTRUCTION, List.of("industrial", "modern"),
            Industry.FINANCE, List.of("luxury", "modern")));

    private final int maxVariants;

    public StyleCatalog(int maxVariants) {
        this.maxVariants = maxVariants;
    }

    public List<String> knownStyles(WorkflowStep step) {
        List<String> styles = KNOWN_STYLES.get(step);
        if (styles == null) {
            throw new ValidationException("Step " + step.key() + " has no visual styles.");
        }
        return styles;
    }

    /**
     * Explicitly requested styles win; otherwise the industry precedence is used and padded
     * with the remaining known styles. Never returns more than {@code maxVariants} styles.
     *
     * @throws ValidationException on unknown styles or too many requested styles
     */
    public List<String> chooseStyles(WorkflowStep step, Industry industry, List<String> requested) {
        List<String> known = knownStyles(step);
        if (requested != null && !requested.isEmpty()) {
            Set<String> chosen = new LinkedHashSet<>();
            for (String raw : requested) {
                String style = StringUtils.hasText(raw) ? raw.trim().toLowerCase(Locale.ROOT) : "";
                if (!known.contains(style)) {
                    throw new ValidationException("Unknown " + step.key() + " style '" + raw + "'. Known styles: "
                            + String.join(", ", known) + ".");
                }
                chosen.add(style);
            }
            if (chosen.size() > maxVariants) {
                throw new ValidationException("At most " + maxVariants + " styles may be requested, got " + chosen.size() + ".");
            }
            return List.copyOf(chosen);
        }
        Map<Industry, List<String>> precedence = step == WorkflowStep.SIGNAGE ? SIGNAGE_PRECEDENCE : INTERIOR_PRECEDENCE;
        Set<String> ordered = new LinkedHashSet<>(precedence.getOrDefault(industry, List.of()));
        ordered.addAll(known);
        List<String> result = new ArrayList<>(ordered);
        return List.copyOf(result.subList(0, Math.min(maxVariants, result.size())));
    }
}
