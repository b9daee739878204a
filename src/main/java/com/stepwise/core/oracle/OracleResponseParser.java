package com.stepwise.core.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Extracts the first well-formed JSON object or array from free text.
 * <p>
 * Scans for each opening bracket of the requested kind and tries the text up to its
 * matching close bracket (string-aware), moving on to the next candidate when that
 * fragment does not parse. Markdown code fences are tolerated.
 */
@Component
public class OracleResponseParser {

    private final ObjectMapper mapper;

    public OracleResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public OracleResponse parseObject(String text) {
        return parse(text, '{', '}');
    }

    public OracleResponse parseArray(String text) {
        return parse(text, '[', ']');
    }

    private OracleResponse parse(String text, char open, char close) {
        if (text == null || text.isBlank()) {
            return new OracleResponse.Empty();
        }
        String lastError = "no " + open + "..." + close + " structure found";
        int from = text.indexOf(open);
        while (from >= 0) {
            int end = matchingClose(text, from, open, close);
            if (end < 0) {
                lastError = "unterminated " + open + " at offset " + from;
                break;
            }
            try {
                JsonNode node = mapper.readTree(text.substring(from, end + 1));
                if (node != null) {
                    return new OracleResponse.Parsed(node);
                }
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
            }
            from = text.indexOf(open, from + 1);
        }
        return new OracleResponse.Malformed(text, lastError);
    }

    private static int matchingClose(String text, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
