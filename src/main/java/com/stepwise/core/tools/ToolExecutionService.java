package com.stepwise.core.tools;

import com.stepwise.core.model.ToolDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Performs named operations with arguments.
 * <p>
 * Calls must be safe to repeat with identical arguments; the orchestration assumes no
 * exactly-once guarantee. Timeouts are the implementation's concern. The handle is
 * shared read-only by all components and closed only by the engine at teardown.
 */
public interface ToolExecutionService extends AutoCloseable {

    /**
     * Invokes {@code name} with {@code arguments}.
     *
     * @return the tool's text result (may be empty)
     * @throws ToolInvocationException if the tool reported failure or could not be reached
     */
    String invoke(String name, Map<String, Object> arguments) throws ToolInvocationException;

    /**
     * Lists the tools this service offers, with their documented signatures.
     */
    List<ToolDescriptor> listTools();

    @Override
    default void close() {
    }
}
