package com.stepwise.core.oracle;

/**
 * Thrown when the reasoning oracle cannot be reached or fails to answer.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
