package com.stepwise.core.tools;

import com.stepwise.core.model.ToolDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the tools available to a run and their signatures.
 * Static metadata, not part of run state.
 */
public final class ToolCatalog {

    private final Map<String, ToolDescriptor> tools;

    public ToolCatalog(List<ToolDescriptor> descriptors) {
        var byName = new LinkedHashMap<String, ToolDescriptor>();
        for (var d : descriptors) {
            byName.putIfAbsent(d.name(), d);
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public static ToolCatalog of(ToolExecutionService service) {
        return new ToolCatalog(service.listTools());
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public List<ToolDescriptor> descriptors() {
        return List.copyOf(tools.values());
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    /**
     * Renders one {@code - signature} line per tool, optionally limited to {@code names}.
     */
    public String describe(List<String> names) {
        return tools.values().stream()
                .filter(d -> names == null || names.isEmpty() || names.contains(d.name()))
                .map(d -> "- " + d.signature())
                .collect(Collectors.joining("\n"));
    }

    public String describeAll() {
        return describe(List.of());
    }
}
