package com.brandflow.generation;

import java.util.Map;

public final class GenerationConstants {

    private GenerationConstants() {
    }

    public static final String FALLBACK_PROVIDER_ID = "fallback";

    // Metadata keys carried on variants and execution records
    public static final String META_REASON = "reason";
    public static final String META_ATTEMPTS = "attempts";
    public static final String META_ERROR_TYPE = "errorType";
    public static final String META_STYLES = "styles";
    public static final String META_FALLBACKS = "fallbacks";
    public static final String META_SKIPPED = "skipped";

    // Fallback reasons
    public static final String REASON_DEADLINE = "deadline_exceeded";
    public static final String REASON_CLIENT_UNAVAILABLE = "client_unavailable";
    public static final String REASON_NO_PROVIDERS = "no_providers";
    public static final String REASON_UNEXPECTED = "unexpected_error";

    public static final String SIGNAGE_PROMPT_TEMPLATE = """
            Storefront signboard for a %s business called "%s" in %s, Korea. \
            Business size: %s. Style: %s, %s. \
            The business name must be clearly legible on the sign. %s\
            """;

    public static final String INTERIOR_PROMPT_TEMPLATE = """
            Interior design concept for a %s business called "%s" in %s, Korea. \
            Business size: %s. Style: %s, %s. \
            Keep the look consistent with its %s storefront signage. %s\
            """;

    public static final Map<String, String> STYLE_DESCRIPTIONS = Map.ofEntries(
            Map.entry("modern", "clean lines, contemporary typography and a restrained palette"),
            Map.entry("classic", "traditional serif lettering, warm wood and brass accents"),
            Map.entry("vibrant", "bold saturated colours, playful shapes and high contrast"),
            Map.entry("minimal", "generous negative space, monochrome palette and a single accent"),
            Map.entry("cozy", "soft warm lighting, natural textures and comfortable seating"),
            Map.entry("luxury", "premium materials, marble and gold details, dramatic lighting"),
            Map.entry("industrial", "exposed brick and concrete, metal fixtures and Edison bulbs")
    );

    public static final String GENERATED_MESSAGE = "Generated %d of %d %s variants.";
    public static final String ALL_FALLBACK_MESSAGE = "Image generation is unavailable right now; showing %d default %s designs.";
}
