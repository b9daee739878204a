package com.stepwise.core.nodes;

import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.logging.MdcContext;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.model.ProgressKind;
import com.stepwise.core.model.ProgressRecord;
import com.stepwise.core.model.ToolExecution;
import com.stepwise.core.model.ValidationResult;
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolExecutionService;
import com.stepwise.core.tools.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Cross-checks result-sensitive calculations by re-invoking the calculation tool with
 * the complementary classification value.
 * <p>
 * Each not-yet-validated execution gets one {@link ValidationResult}. Cross-checks are
 * independent tool calls with no shared state, so they run in parallel. A failed
 * cross-check lowers confidence instead of failing the run.
 */
@Component
public class ValidateNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateNode.class);

    static final double CONSISTENT_CONFIDENCE = 0.95;
    static final double INCONSISTENT_CONFIDENCE = 0.6;
    static final double UNAVAILABLE_CONFIDENCE = 0.7;

    private final ToolExecutionService toolService;
    private final StepwiseMetrics metrics;
    private final StepwiseProperties.Validation settings;
    private final int previewLength;

    public ValidateNode(ToolExecutionService toolService, StepwiseMetrics metrics, StepwiseProperties properties) {
        this.toolService = toolService;
        this.metrics = metrics;
        this.settings = properties.getValidation();
        this.previewLength = properties.getSynthesis().getResultPreviewLength();
    }

    public Map<String, Object> apply(RunState state) {
        int nextIteration = state.iterationCount() + 1;
        List<ToolExecution> pending = pendingExecutions(state);

        if (pending.isEmpty()) {
            log.info("No calculations require cross-validation");
            return Map.of(
                    RunState.PROGRESS_LOG, List.of(ProgressRecord.of(ProgressKind.VALIDATION,
                            "No calculations require cross-validation", Map.of("validated_count", 0))),
                    RunState.NEEDS_VALIDATION, false,
                    RunState.ITERATION_COUNT, nextIteration
            );
        }

        log.info("Cross-validating {} execution(s) of {}", pending.size(), settings.getTool());
        List<ValidationResult> results = crossCheckAll(state.runKey(), pending);

        double average = results.stream().mapToDouble(ValidationResult::confidence).average().orElse(1.0);
        boolean allValid = results.stream().allMatch(ValidationResult::valid);
        results.forEach(v -> metrics.recordValidationConfidence(v.confidence()));

        var progress = new ArrayList<ProgressRecord>();
        for (ToolExecution execution : pending) {
            progress.add(ProgressRecord.of(ProgressKind.VALIDATION,
                    "Cross-validating results from " + execution.toolName(),
                    Map.of("execution_id", execution.id(), "tool", execution.toolName(),
                            "subtask_id", execution.subtaskId())));
        }
        var summary = new LinkedHashMap<String, Object>();
        summary.put("validated_count", results.size());
        summary.put("average_confidence", average);
        summary.put("all_valid", allValid);
        progress.add(ProgressRecord.of(ProgressKind.VALIDATION,
                String.format("Validated %d calculation(s) with average confidence: %.2f", results.size(), average),
                summary));

        return Map.of(
                RunState.VALIDATIONS, results,
                RunState.NEEDS_VALIDATION, false,
                RunState.PROGRESS_LOG, List.copyOf(progress),
                RunState.ITERATION_COUNT, nextIteration
        );
    }

    /**
     * Successful executions of the calculation tool that no validation refers to yet.
     */
    List<ToolExecution> pendingExecutions(RunState state) {
        Set<String> validated = state.validations().stream()
                .map(ValidationResult::executionId)
                .collect(Collectors.toSet());
        return state.toolLog().stream()
                .filter(e -> settings.getTool().equals(e.toolName()))
                .filter(ToolExecution::hasResult)
                .filter(e -> !validated.contains(e.id()))
                .toList();
    }

    private List<ValidationResult> crossCheckAll(String runKey, List<ToolExecution> pending) {
        int threads = Math.max(1, Math.min(settings.getParallelism(), pending.size()));
        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "cross-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<ValidationResult>>();
            for (ToolExecution execution : pending) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    MdcContext.setSubtask(runKey, execution.subtaskId());
                    try {
                        return crossCheck(execution);
                    } finally {
                        MdcContext.clear();
                    }
                }, executor));
            }
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            executor.shutdown();
        }
    }

    ValidationResult crossCheck(ToolExecution execution) {
        String parameter = settings.getParameter();
        Object originalValue = execution.arguments().get(parameter);
        String alternateValue = settings.alternateFor(originalValue);

        var alternateArgs = new LinkedHashMap<>(execution.arguments());
        alternateArgs.put(parameter, alternateValue);

        var original = new LinkedHashMap<String, Object>();
        original.put(parameter, originalValue == null ? "" : originalValue.toString());
        original.put("result", TextPreview.truncate(execution.result(), previewLength));

        String alternateResult;
        try {
            alternateResult = toolService.invoke(execution.toolName(), alternateArgs);
        } catch (ToolInvocationException | RuntimeException e) {
            log.warn("Cross-validation of {} failed: {}", execution.id(), e.getMessage());
            return new ValidationResult(execution.id(), true, UNAVAILABLE_CONFIDENCE,
                    List.of("Cross-validation failed: " + e.getMessage()),
                    Map.of("original", original));
        }

        var alternate = new LinkedHashMap<String, Object>();
        alternate.put(parameter, alternateValue);
        alternate.put("result", TextPreview.truncate(alternateResult == null ? "" : alternateResult, previewLength));
        var evidence = new LinkedHashMap<String, Object>();
        evidence.put("original", original);
        evidence.put("alternative", alternate);

        boolean consistent = execution.hasResult() && alternateResult != null && !alternateResult.isBlank();
        if (consistent) {
            return new ValidationResult(execution.id(), true, CONSISTENT_CONFIDENCE, List.of(), evidence);
        }
        return new ValidationResult(execution.id(), false, INCONSISTENT_CONFIDENCE,
                List.of("Alternative " + parameter + " " + alternateValue
                        + " produced a different result structure (one result empty)"),
                evidence);
    }
}
