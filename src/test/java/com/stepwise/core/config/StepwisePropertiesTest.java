package com.stepwise.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepwisePropertiesTest {

    @Test
    @DisplayName("defaults match the run budget")
    void defaults() {
        var props = new StepwiseProperties();
        assertEquals(15, props.getRun().getMaxIterations());
        assertEquals(3, props.getRun().getMaxRetries());
        assertTrue(props.getRun().getGraphStepLimit() > props.getRun().getMaxIterations());
        assertEquals("calculate_hypothetical_pnl", props.getValidation().getTool());
        assertEquals("hierarchy", props.getValidation().getParameter());
        assertEquals(200, props.getSynthesis().getResultPreviewLength());
    }

    @Test
    @DisplayName("alternateFor maps each classification to its complement")
    void alternateForKnownValues() {
        var validation = new StepwiseProperties().getValidation();
        assertEquals("PRA", validation.alternateFor("FHC"));
        assertEquals("FHC", validation.alternateFor("PRA"));
    }

    @Test
    @DisplayName("alternateFor falls back to the first different known value")
    void alternateForUnknownValue() {
        var validation = new StepwiseProperties().getValidation();
        validation.setAlternates(new LinkedHashMap<>(Map.of("FHC", "PRA")));
        assertEquals("FHC", validation.alternateFor("OTHER"));
        assertEquals("FHC", validation.alternateFor(null));
    }
}
