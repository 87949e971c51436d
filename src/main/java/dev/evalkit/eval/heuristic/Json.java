package dev.evalkit.eval.heuristic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.evalkit.json.EvalJsonMapper;
import java.util.Optional;

/** JSON parsing helpers for the parsing metrics. */
final class Json {
    private Json() {}

    /** The parsed document, or empty if {@code text} is not exactly one JSON value. */
    static Optional<JsonNode> parse(String text) {
        try {
            var node = EvalJsonMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Parse error message, or empty if {@code text} is valid JSON. */
    static Optional<String> parseError(String text) {
        try {
            var node = EvalJsonMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                return Optional.of("no content");
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.of(e.getOriginalMessage());
        }
    }

    static String typeOf(JsonNode node) {
        if (node.isTextual()) {
            return "string";
        } else if (node.isNumber()) {
            return "number";
        } else if (node.isBoolean()) {
            return "boolean";
        } else if (node.isArray()) {
            return "array";
        } else if (node.isObject()) {
            return "object";
        } else if (node.isNull()) {
            return "null";
        }
        return "unknown";
    }
}
