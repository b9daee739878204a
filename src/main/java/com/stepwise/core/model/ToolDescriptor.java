package com.stepwise.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Static metadata about a tool offered by the tool-execution service.
 *
 * @param name        tool name used for invocation
 * @param description what the tool does
 * @param parameters  parameter names, required ones first
 */
public record ToolDescriptor(
    String name,
    String description,
    List<String> parameters
) implements Serializable {

    public ToolDescriptor {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        description = description == null ? "" : description;
    }

    /** Renders as {@code name(a, b): description}. */
    public String signature() {
        String sig = name + "(" + String.join(", ", parameters) + ")";
        return description.isBlank() ? sig : sig + ": " + description;
    }
}
