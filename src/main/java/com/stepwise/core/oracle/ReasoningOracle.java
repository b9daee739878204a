package com.stepwise.core.oracle;

/**
 * Black-box judgment service: turns a natural-language instruction plus context
 * into free text that should contain one JSON object or array.
 * <p>
 * Callers must treat the response as untrusted and parse it with
 * {@link OracleResponseParser}. Implementations do not retry.
 */
@FunctionalInterface
public interface ReasoningOracle {

    /**
     * @param instruction what the oracle is asked to decide
     * @param context     supporting material (request, prior results)
     * @return raw response text, possibly empty
     * @throws OracleException if the oracle could not be reached
     */
    String decide(String instruction, String context);
}
