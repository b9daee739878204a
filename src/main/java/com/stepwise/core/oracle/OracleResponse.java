package com.stepwise.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tagged result of parsing an oracle response. Every call site handles all three
 * variants explicitly.
 */
public sealed interface OracleResponse permits OracleResponse.Parsed, OracleResponse.Malformed, OracleResponse.Empty {

    /** The first well-formed JSON structure found in the response. */
    record Parsed(JsonNode value) implements OracleResponse {}

    /** Non-empty text with no usable JSON structure. */
    record Malformed(String rawText, String reason) implements OracleResponse {}

    /** Null or blank response. */
    record Empty() implements OracleResponse {}
}
