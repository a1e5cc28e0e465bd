package com.brandflow.generation;

import com.brandflow.workflow.model.BlobReference;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.WorkflowStep;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Map;

/**
 * Pre-registered substitute artwork per step and style. Building a fallback never makes an
 * external call.
 */
public class FallbackCatalog {

    private final Map<String, Map<String, String>> configured;
    private final String baseUrl;

    public FallbackCatalog(Map<String, Map<String, String>> configured, String baseUrl) {
        this.configured = configured == null ? Map.of() : Map.copyOf(configured);
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
    }

    public String urlFor(WorkflowStep step, String style) {
        Map<String, String> byStyle = configured.get(step.key());
        if (byStyle != null && StringUtils.hasText(byStyle.get(style))) {
            return byStyle.get(style);
        }
        return baseUrl + "/" + step.key() + "/" + style + ".svg";
    }

    public GeneratedVariant fallbackVariant(WorkflowStep step, String style, String prompt, String reason, Instant now) {
        return new GeneratedVariant(
                GenerationConstants.FALLBACK_PROVIDER_ID,
                style,
                prompt,
                null,
                BlobReference.fallback(urlFor(step, style)),
                now,
                true,
                Map.of(GenerationConstants.META_REASON, reason));
    }
}
