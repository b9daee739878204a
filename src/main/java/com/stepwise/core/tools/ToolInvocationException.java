package com.stepwise.core.tools;

/**
 * Typed failure of a tool invocation.
 */
public class ToolInvocationException extends Exception {

    public ToolInvocationException(String message) {
        super(message);
    }

    public ToolInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
