package com.brandflow.workflow.model;

import com.brandflow.workflow.exception.InvalidBusinessProfileException;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of the business a session brands. Values come from closed
 * enumerations; anything outside them makes the profile unusable rather than being mapped
 * to a nearby value.
 */
public record BusinessProfile(
        Industry industry,
        Region region,
        BusinessSize size,
        @Nullable String description
) {

    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    public BusinessProfile {
        Objects.requireNonNull(industry, "industry");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(size, "size");
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidBusinessProfileException(
                    "Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters.");
        }
    }

    public static BusinessProfile of(@Nullable String industry,
                                     @Nullable String region,
                                     @Nullable String size,
                                     @Nullable String description) {
        List<String> problems = new ArrayList<>();
        Industry parsedIndustry = Industry.parse(industry).orElse(null);
        if (parsedIndustry == null) {
            problems.add("industry '" + industry + "'");
        }
        Region parsedRegion = Region.parse(region).orElse(null);
        if (parsedRegion == null) {
            problems.add("region '" + region + "'");
        }
        BusinessSize parsedSize = BusinessSize.parse(size).orElse(null);
        if (parsedSize == null) {
            problems.add("size '" + size + "'");
        }
        if (!problems.isEmpty()) {
            throw new InvalidBusinessProfileException("Invalid business profile: " + String.join(", ", problems) + ".");
        }
        String normalizedDescription = StringUtils.hasText(description) ? description.trim() : null;
        return new BusinessProfile(parsedIndustry, parsedRegion, parsedSize, normalizedDescription);
    }
}
