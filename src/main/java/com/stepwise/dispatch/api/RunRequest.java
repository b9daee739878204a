package com.stepwise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param request       natural-language request
 * @param runKey        resumability key; nullable, generated when absent
 * @param maxIterations iteration budget; nullable, defaults to configuration
 * @param maxRetries    recovery budget; nullable, defaults to configuration
 */
public record RunRequest(
    String request,
    @JsonProperty("run_key") String runKey,
    @JsonProperty("max_iterations") Integer maxIterations,
    @JsonProperty("max_retries") Integer maxRetries
) {}
