package com.stepwise.core.config;

import com.stepwise.core.state.RunState;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orchestration settings bound from {@code stepwise.*}.
 *
 * <pre>
 * stepwise:
 *   run:
 *     max-iterations: 15
 *     max-retries: 3
 *   validation:
 *     tool: calculate_hypothetical_pnl
 *     parameter: hierarchy
 *     alternates:
 *       FHC: PRA
 *       PRA: FHC
 *   synthesis:
 *     result-preview-length: 200
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "stepwise")
public class StepwiseProperties {

    private Run run = new Run();
    private Validation validation = new Validation();
    private Synthesis synthesis = new Synthesis();

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public Synthesis getSynthesis() { return synthesis; }
    public void setSynthesis(Synthesis synthesis) { this.synthesis = synthesis; }

    public static class Run {
        private int maxIterations = RunState.DEFAULT_MAX_ITERATIONS;
        private int maxRetries = RunState.DEFAULT_MAX_RETRIES;
        /** LangGraph4j's own step guard. Must stay above the iteration budget. */
        private int graphStepLimit = 100;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getGraphStepLimit() { return graphStepLimit; }
        public void setGraphStepLimit(int graphStepLimit) { this.graphStepLimit = graphStepLimit; }
    }

    public static class Validation {
        private String tool = "calculate_hypothetical_pnl";
        private String parameter = "hierarchy";
        private Map<String, String> alternates = new LinkedHashMap<>(Map.of("FHC", "PRA", "PRA", "FHC"));
        private int parallelism = 4;

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }
        public String getParameter() { return parameter; }
        public void setParameter(String parameter) { this.parameter = parameter; }
        public Map<String, String> getAlternates() { return alternates; }
        public void setAlternates(Map<String, String> alternates) { this.alternates = alternates; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        /**
         * Returns the complementary value for {@code original}: the configured alternate,
         * or else the first known value that differs from it.
         */
        public String alternateFor(Object original) {
            String value = original == null ? "" : original.toString();
            String mapped = alternates.get(value);
            if (mapped != null) {
                return mapped;
            }
            return alternates.keySet().stream()
                    .filter(k -> !k.equals(value))
                    .findFirst()
                    .orElse(value);
        }
    }

    public static class Synthesis {
        private int resultPreviewLength = 200;

        public int getResultPreviewLength() { return resultPreviewLength; }
        public void setResultPreviewLength(int resultPreviewLength) { this.resultPreviewLength = resultPreviewLength; }
    }
}
