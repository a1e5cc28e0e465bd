package com.brandflow.generation;

import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.model.Industry;
import com.brandflow.workflow.model.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyleCatalogTest {

    private final StyleCatalog catalog = new StyleCatalog(3);

    @Test
    void testRestaurantPrecedence() {
        assertEquals(List.of("vibrant", "modern", "classic"),
                catalog.chooseStyles(WorkflowStep.SIGNAGE, Industry.RESTAURANT, null));
        assertEquals(List.of("cozy", "modern", "luxury"),
                catalog.chooseStyles(WorkflowStep.INTERIOR, Industry.RESTAURANT, List.of()));
    }

    @Test
    void testShortPrecedenceIsPaddedFromCatalog() {
        assertEquals(List.of("modern", "cozy", "luxury"),
                catalog.chooseStyles(WorkflowStep.INTERIOR, Industry.HEALTHCARE, null));
    }

    @Test
    void testIndustryWithoutPrecedenceUsesCatalogOrder() {
        assertEquals(List.of("modern", "classic", "vibrant"),
                catalog.chooseStyles(WorkflowStep.SIGNAGE, Industry.OTHER, null));
    }

    @Test
    void testExplicitStylesAreNormalizedAndDeduplicated() {
        assertEquals(List.of("minimal", "classic"),
                catalog.chooseStyles(WorkflowStep.SIGNAGE, Industry.RESTAURANT, List.of(" Minimal", "classic", "MINIMAL")));
    }

    @Test
    void testUnknownStyleIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> catalog.chooseStyles(WorkflowStep.SIGNAGE, Industry.RESTAURANT, List.of("cozy")));
        assertTrue(ex.getMessage().contains("cozy"));
    }

    @Test
    void testTooManyStylesAreRejected() {
        assertThrows(ValidationException.class, () -> catalog.chooseStyles(WorkflowStep.SIGNAGE, Industry.RETAIL,
                List.of("modern", "classic", "vibrant", "minimal")));
    }

    @Test
    void testSmallerLimitCapsDefaults() {
        StyleCatalog single = new StyleCatalog(1);
        assertEquals(List.of("vibrant"), single.chooseStyles(WorkflowStep.SIGNAGE, Industry.RESTAURANT, null));
    }

    @Test
    void testNonVisualStepHasNoStyles() {
        assertThrows(ValidationException.class, () -> catalog.knownStyles(WorkflowStep.NAMING));
    }
}
