package com.brandflow.support;

import com.brandflow.workflow.model.AnalysisSummary;
import com.brandflow.workflow.model.BlobReference;
import com.brandflow.workflow.model.BusinessProfile;
import com.brandflow.workflow.model.GeneratedVariant;
import com.brandflow.workflow.model.NameSuggestion;
import com.brandflow.workflow.model.NameSuggestionSet;
import com.brandflow.workflow.model.VariantSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Sessions at a given point of the workflow, written straight into a store.
 */
public final class SessionFixtures {

    public static final String SELECTED_NAME = "Seoul Table";

    private SessionFixtures() {
    }

    public static BusinessProfile restaurantProfile() {
        return BusinessProfile.of("restaurant", "seoul", "small", "Family-run noodle place");
    }

    public static WorkflowSession atStep(InMemorySessionStore store, WorkflowStep step, Instant now) {
        WorkflowSession session = WorkflowSession.start(restaurantProfile(), now, now.plus(Duration.ofHours(24)));
        if (step.number() >= WorkflowStep.NAMING.number()) {
            session.setAnalysis(new AnalysisSummary("Busy lunch area", 72, List.of("Office workers nearby"), now));
        }
        if (step.number() >= WorkflowStep.SIGNAGE.number()) {
            session.setNames(NameSuggestionSet.initial(List.of(
                    new NameSuggestion(SELECTED_NAME, "Warm and local"),
                    new NameSuggestion("Noodle Harbor", "Seaside feel"),
                    new NameSuggestion("Hearth & Co.", "Homely"))).withSelection(SELECTED_NAME));
        }
        if (step.number() >= WorkflowStep.INTERIOR.number()) {
            VariantSet signage = variants(WorkflowStep.SIGNAGE, now, "vibrant", "modern", "classic");
            session.setSignage(signage.withSelection(signage.variants().get(0).url()));
        }
        if (step.number() >= WorkflowStep.REPORT.number()) {
            VariantSet interior = variants(WorkflowStep.INTERIOR, now, "cozy", "modern", "luxury");
            session.setInterior(interior.withSelection(interior.variants().get(1).url()));
        }
        session.setCurrentStep(step.number());
        return store.create(session);
    }

    public static VariantSet variants(WorkflowStep step, Instant now, String... styles) {
        List<GeneratedVariant> variants = Arrays.stream(styles)
                .map(style -> variant(step, style, now))
                .toList();
        return VariantSet.of(step, variants);
    }

    public static GeneratedVariant variant(WorkflowStep step, String style, Instant now) {
        String key = step.key() + "/fixture/" + style + ".png";
        return new GeneratedVariant("dalle", style, "prompt for " + style, null,
                BlobReference.durable("http://localhost:8080/api/blobs/" + key + "?sig=1", key, now.plus(Duration.ofHours(1))),
                now, false, Map.of());
    }
}
