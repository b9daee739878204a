package com.stepwise.dispatch.api;

import com.stepwise.core.engine.RunEngine;
import com.stepwise.core.engine.RunOptions;
import com.stepwise.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * REST controller for starting, resuming and observing runs.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunEngine runEngine;
    private final SseStreamingService sseStreamingService;

    /** Runs started through this controller, with their last known state. */
    private final ConcurrentHashMap<String, RunState> runStates = new ConcurrentHashMap<>();

    /** Engine failures by run key. */
    private final ConcurrentHashMap<String, String> failures = new ConcurrentHashMap<>();

    public RunController(RunEngine runEngine, SseStreamingService sseStreamingService) {
        this.runEngine = runEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Start a new run. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startRun(@RequestBody RunRequest request) {
        if (request.request() == null || request.request().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        RunOptions options;
        try {
            String key = request.runKey() != null && !request.runKey().isBlank()
                    ? request.runKey()
                    : runEngine.generateRunKey();
            options = new RunOptions(key, request.maxIterations(), request.maxRetries());
            runEngine.checkOptions(options);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        String runKey = options.runKey();
        RunState placeholder = new RunState(Map.of(
                RunState.RUN_KEY, runKey,
                RunState.REQUEST, request.request()
        ));
        if (runEngine.getState(runKey).isPresent() || runStates.putIfAbsent(runKey, placeholder) != null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Run key already in use: " + runKey));
        }
        log.info("Accepted run {}, launching async execution", runKey);
        launch(runKey, () -> runEngine.run(request.request(), options));

        return ResponseEntity.accepted().body(Map.of("run_key", runKey, "status", "RUNNING"));
    }

    /**
     * POST /api/v1/runs/{key}/resume: Continue an interrupted run.
     */
    @PostMapping("/{key}/resume")
    public ResponseEntity<Map<String, String>> resumeRun(@PathVariable String key) {
        Optional<RunState> saved = runEngine.getState(key);
        if (saved.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (saved.get().isFinished()) {
            return ResponseEntity.ok(Map.of("run_key", key, "status", saved.get().outcome().name()));
        }
        failures.remove(key);
        runStates.put(key, saved.get());
        launch(key, () -> runEngine.resume(key));
        return ResponseEntity.accepted().body(Map.of("run_key", key, "status", "RUNNING"));
    }

    /**
     * GET /api/v1/runs: List runs started through this controller.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns() {
        return ResponseEntity.ok(runStates.keySet().stream()
                .map(this::currentView)
                .flatMap(Optional::stream)
                .toList());
    }

    /**
     * GET /api/v1/runs/{key}: Latest state of a run, read from its checkpoint.
     */
    @GetMapping("/{key}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String key) {
        return currentView(key)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/runs/{key}/events: SSE stream of the run's progress events.
     */
    @GetMapping(value = "/{key}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String key) {
        if (!runStates.containsKey(key) && runEngine.getState(key).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(key));
    }

    private void launch(String runKey, Supplier<RunState> work) {
        CompletableFuture.runAsync(() -> {
            try {
                RunState result = work.get();
                if (result != null) {
                    runStates.put(runKey, result);
                }
            } catch (Exception e) {
                log.error("Run {} failed", runKey, e);
                failures.put(runKey, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        });
    }

    private Optional<RunResponse> currentView(String key) {
        Optional<RunState> state = runEngine.getState(key);
        if (state.isEmpty()) {
            state = Optional.ofNullable(runStates.get(key));
        }
        String failure = failures.get(key);
        return state.map(s -> failure != null && !s.isFinished()
                ? RunResponse.from(s, "FAILED")
                : RunResponse.from(s));
    }
}
