package com.stepwise.core.graph;

import com.stepwise.core.config.StepwiseProperties;
import com.stepwise.core.logging.MdcContext;
import com.stepwise.core.nodes.DecomposeNode;
import com.stepwise.core.nodes.ExecuteStepNode;
import com.stepwise.core.nodes.RecoverNode;
import com.stepwise.core.nodes.SynthesizeNode;
import com.stepwise.core.nodes.ValidateNode;
import com.stepwise.core.state.RunState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a run.
 * <p>
 * Every non-terminal node hands control back to the {@link Router}, so the graph is a
 * hub around a single routing function:
 * <pre>
 *   START -> [routeEntry] -> decompose | execute | validate | recover | synthesize
 *   decompose | execute | validate | recover -> [route] -> (any of the five)
 *   synthesize -> END
 * </pre>
 */
@Component
public class StepwiseGraph {

    private static final Logger log = LoggerFactory.getLogger(StepwiseGraph.class);

    private final CompiledGraph<RunState> compiledGraph;

    public StepwiseGraph(
            DecomposeNode decomposeNode,
            ExecuteStepNode executeNode,
            ValidateNode validateNode,
            RecoverNode recoverNode,
            SynthesizeNode synthesizeNode,
            Router router,
            StepwiseProperties properties,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {

        Map<String, String> targets = new LinkedHashMap<>();
        for (Step step : Step.values()) {
            targets.put(step.nodeName(), step.nodeName());
        }

        var graph = new StateGraph<>(RunState.SCHEMA, RunState::new)
                .addNode(Step.DECOMPOSE.nodeName(), node_async(inStep(Step.DECOMPOSE, decomposeNode::apply)))
                .addNode(Step.EXECUTE.nodeName(), node_async(inStep(Step.EXECUTE, executeNode::apply)))
                .addNode(Step.VALIDATE.nodeName(), node_async(inStep(Step.VALIDATE, validateNode::apply)))
                .addNode(Step.RECOVER.nodeName(), node_async(inStep(Step.RECOVER, recoverNode::apply)))
                .addNode(Step.SYNTHESIZE.nodeName(), node_async(inStep(Step.SYNTHESIZE, synthesizeNode::apply)))
                .addConditionalEdges(START, edge_async(router::routeEntry), targets)
                .addConditionalEdges(Step.DECOMPOSE.nodeName(), edge_async(router::route), targets)
                .addConditionalEdges(Step.EXECUTE.nodeName(), edge_async(router::route), targets)
                .addConditionalEdges(Step.VALIDATE.nodeName(), edge_async(router::route), targets)
                .addConditionalEdges(Step.RECOVER.nodeName(), edge_async(router::route), targets)
                .addEdge(Step.SYNTHESIZE.nodeName(), END);

        var configBuilder = CompileConfig.builder()
                .recursionLimit(properties.getRun().getGraphStepLimit());
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver (runs cannot be resumed)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    /**
     * Tags the node's log lines with its step before it runs.
     */
    static NodeAction<RunState> inStep(Step step, NodeAction<RunState> action) {
        return state -> {
            MdcContext.setStep(state.runKey(), step.nodeName());
            return action.apply(state);
        };
    }

    public CompiledGraph<RunState> getCompiledGraph() {
        return compiledGraph;
    }
}
