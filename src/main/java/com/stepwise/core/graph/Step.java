package com.stepwise.core.graph;

/**
 * The five components of the orchestration graph, with their node names.
 */
public enum Step {
    DECOMPOSE("decompose"),
    EXECUTE("execute"),
    VALIDATE("validate"),
    RECOVER("recover"),
    SYNTHESIZE("synthesize");

    private final String nodeName;

    Step(String nodeName) {
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }

    public static boolean isNode(String name) {
        for (Step step : values()) {
            if (step.nodeName.equals(name)) {
                return true;
            }
        }
        return false;
    }

    public static Step fromNodeName(String name) {
        for (Step step : values()) {
            if (step.nodeName.equals(name)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown step: " + name);
    }
}
