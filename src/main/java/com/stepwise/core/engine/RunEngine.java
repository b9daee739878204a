package com.stepwise.core.engine;

import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.events.EventBus;
import com.stepwise.core.events.ProgressEventTranslator;
import com.stepwise.core.events.RunEvent;
import com.stepwise.core.graph.Step;
import com.stepwise.core.graph.StepwiseGraph;
import com.stepwise.core.logging.MdcContext;
import com.stepwise.core.metrics.StepwiseMetrics;
import com.stepwise.core.persistence.CheckpointQueryService;
import com.stepwise.core.state.RunState;
import com.stepwise.core.tools.ToolCatalog;
import com.stepwise.core.tools.ToolExecutionService;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives runs through the compiled graph.
 * <p>
 * Each run is a LangGraph4j thread identified by its run key, so state is checkpointed
 * after every step and an interrupted run can be resumed under the same key. After each
 * merged step the engine translates the state change into events and publishes them.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    /** Graph steps a run needs beyond its iteration budget. */
    static final int GRAPH_STEP_HEADROOM = 5;

    private final StepwiseGraph graph;
    private final CheckpointQueryService checkpoints;
    private final ProgressEventTranslator translator;
    private final EventBus eventBus;
    private final StepwiseMetrics metrics;
    private final ToolCatalog catalog;
    private final ToolExecutionService toolService;
    private final StepwiseProperties properties;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    public RunEngine(StepwiseGraph graph, CheckpointQueryService checkpoints,
                     ProgressEventTranslator translator, EventBus eventBus, StepwiseMetrics metrics,
                     ToolCatalog catalog, ToolExecutionService toolService, StepwiseProperties properties) {
        this.graph = graph;
        this.checkpoints = checkpoints;
        this.translator = translator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.catalog = catalog;
        this.toolService = toolService;
        this.properties = properties;
    }

    public RunState run(String request) {
        return run(request, RunOptions.defaults());
    }

    /**
     * Starts a new run and blocks until it produces a final answer.
     *
     * @throws IllegalArgumentException if the iteration budget does not fit the graph step limit
     * @throws IllegalStateException    if the run key already identifies a run
     * @throws RunFailedException       if the engine fails while driving the graph
     */
    public RunState run(String request, RunOptions options) {
        int maxIterations = checkOptions(options);
        String runKey = options.hasRunKey() ? options.runKey() : generateRunKey();
        if (checkpoints.exists(runKey)) {
            throw new IllegalStateException("Run key already in use: " + runKey + " (use resume instead)");
        }
        int maxRetries = options.maxRetries() != null
                ? options.maxRetries() : properties.getRun().getMaxRetries();

        Map<String, Object> input = RunState.initial(runKey, request, catalog.names(), maxIterations, maxRetries);
        log.info("Starting run {} (maxIterations={}, maxRetries={}) for request: {}",
                runKey, maxIterations, maxRetries, request);
        return execute(runKey, input, new RunState(input));
    }

    /**
     * Continues an interrupted run from its latest checkpoint. A finished run is
     * returned as is.
     *
     * @throws IllegalStateException if no run exists under {@code runKey}
     */
    public RunState resume(String runKey) {
        RunState saved = checkpoints.getLatestState(runKey)
                .orElseThrow(() -> new IllegalStateException("No run found for key " + runKey));
        if (saved.isFinished()) {
            log.info("Run {} already finished with outcome {}", runKey, saved.outcome());
            return saved;
        }
        log.info("Resuming run {} at iteration {}", runKey, saved.iterationCount());
        return execute(runKey, Map.of(), saved);
    }

    /**
     * Resolves the iteration budget of {@code options} and checks that the run reaches
     * synthesis before LangGraph4j's own step limit. Every node costs one iteration,
     * synthesis runs once more after the budget is spent, and the graph's start, end and
     * completion take steps of their own.
     *
     * @return the effective iteration budget
     * @throws IllegalArgumentException if the budget leaves no headroom under the graph step limit
     */
    public int checkOptions(RunOptions options) {
        int maxIterations = options.maxIterations() != null
                ? options.maxIterations() : properties.getRun().getMaxIterations();
        int stepLimit = properties.getRun().getGraphStepLimit();
        int highest = stepLimit - GRAPH_STEP_HEADROOM;
        if (maxIterations > highest) {
            throw new IllegalArgumentException("maxIterations must be at most " + highest
                    + " (graph step limit " + stepLimit + "), got " + maxIterations);
        }
        return maxIterations;
    }

    public Optional<RunState> getState(String runKey) {
        return checkpoints.getLatestState(runKey);
    }

    private RunState execute(String runKey, Map<String, Object> input, RunState starting) {
        if (!activeRuns.add(runKey)) {
            throw new IllegalStateException("Run " + runKey + " is already executing");
        }
        MdcContext.setRun(runKey);
        RunState previous = starting;
        try {
            var config = RunnableConfig.builder()
                    .threadId(runKey)
                    .build();

            for (var output : graph.getCompiledGraph().stream(input, config)) {
                RunState current = output.state();
                if (!Step.isNode(output.node())) {
                    previous = current;
                    continue;
                }
                Step step = Step.fromNodeName(output.node());
                metrics.recordStep(step.nodeName());
                log.debug("Step {} finished at iteration {}", step.nodeName(), current.iterationCount());
                for (RunEvent event : translator.translate(step, previous, current)) {
                    eventBus.publish(event);
                }
                previous = current;
            }

            if (!previous.isFinished()) {
                throw new IllegalStateException("Graph stopped before producing a final answer");
            }
            metrics.recordRunOutcome(previous.outcome());
            log.info("Run {} finished with outcome {} after {} iterations",
                    runKey, previous.outcome(), previous.iterationCount());
            return previous;
        } catch (Exception e) {
            log.error("Run {} failed: {}", runKey, e.getMessage(), e);
            eventBus.publish(translator.error(runKey, e.getMessage(), previous));
            throw new RunFailedException(runKey, "Run " + runKey + " failed: " + e.getMessage(), e);
        } finally {
            activeRuns.remove(runKey);
            MdcContext.clear();
        }
    }

    /**
     * Generates a run key in the format STEP-YYYY-NNNN.
     */
    public String generateRunKey() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String key = String.format("STEP-%d-%04d", year, count);
        while (checkpoints.exists(key)) {
            key = String.format("STEP-%d-%04d", year, RUN_COUNTER.incrementAndGet());
        }
        return key;
    }

    @PreDestroy
    public void close() {
        try {
            toolService.close();
        } catch (Exception e) {
            log.warn("Failed to close tool execution service: {}", e.getMessage());
        }
    }
}
