package com.brandflow.generation;

import com.brandflow.workflow.model.BusinessProfile;
import com.brandflow.workflow.model.WorkflowStep;
import org.springframework.util.StringUtils;

import static com.brandflow.generation.GenerationConstants.INTERIOR_PROMPT_TEMPLATE;
import static com.brandflow.generation.GenerationConstants.SIGNAGE_PROMPT_TEMPLATE;
import static com.brandflow.generation.GenerationConstants.STYLE_DESCRIPTIONS;

public class VisualPromptBuilder {

    /**
     * @param signageStyle style of the selected signage, used to keep interiors consistent;
     *                     ignored for signage prompts
     */
    public String build(WorkflowStep step, String style, BusinessProfile profile, String businessName,
                        String signageStyle) {
        String styleDescription = STYLE_DESCRIPTIONS.getOrDefault(style, style);
        String description = StringUtils.hasText(profile.description()) ? "Context: " + profile.description() : "";
        return switch (step) {
            case SIGNAGE -> SIGNAGE_PROMPT_TEMPLATE.formatted(profile.industry().key(), businessName,
                    profile.region().key(), profile.size().key(), style, styleDescription, description).trim();
            case INTERIOR -> INTERIOR_PROMPT_TEMPLATE.formatted(profile.industry().key(), businessName,
                    profile.region().key(), profile.size().key(), style, styleDescription,
                    StringUtils.hasText(signageStyle) ? signageStyle : "chosen", description).trim();
            default -> throw new IllegalArgumentException("Step " + step.key() + " has no visual prompt.");
        };
    }
}
