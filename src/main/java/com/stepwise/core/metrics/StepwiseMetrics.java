package com.stepwise.core.metrics;

import com.stepwise.core.model.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class StepwiseMetrics {

    private final MeterRegistry registry;

    public StepwiseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunOutcome(RunOutcome outcome) {
        Counter.builder("stepwise.runs.total")
                .tag("outcome", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordStep(String step) {
        Counter.builder("stepwise.steps.total")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordToolCall(String tool, boolean success, long ms) {
        Timer.builder("stepwise.tool.duration")
                .tag("tool", tool)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records which recovery tactic was chosen.
     *
     * @param tactic "retry", "alternative_tool", "skip_alternative", "replan" or "give_up"
     */
    public void recordRecoveryTier(String tactic) {
        Counter.builder("stepwise.recovery.tiers")
                .description("Recovery tactics chosen after subtask failures")
                .tag("tactic", tactic)
                .register(registry)
                .increment();
    }

    public void recordValidationConfidence(double confidence) {
        DistributionSummary.builder("stepwise.validation.confidence")
                .description("Confidence of cross-checked calculations")
                .register(registry)
                .record(confidence);
    }
}
