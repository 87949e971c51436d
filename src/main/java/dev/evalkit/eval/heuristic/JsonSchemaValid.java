package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a JSON object output against a flat schema of required keys and their types.
 *
 * <p>Types are {@code string}, {@code number}, {@code boolean}, {@code array}, {@code object} and
 * {@code null}. The score is the fraction of keys which are present with the right type.
 */
public final class JsonSchemaValid extends BaseMetric {
    private final Map<String, String> required;

    /** @param required key to expected type, checked in iteration order */
    public JsonSchemaValid(Map<String, String> required) {
        super("json_schema_valid");
        this.required = Collections.unmodifiableMap(new LinkedHashMap<>(required));
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var parsed = Json.parse(input.output()).filter(n -> n.isObject());
        if (parsed.isEmpty()) {
            return fail("not a valid JSON object");
        }
        var object = parsed.get();
        List<String> errors = new ArrayList<>();
        for (var entry : required.entrySet()) {
            var key = entry.getKey();
            var expectedType = entry.getValue();
            if (!object.has(key)) {
                errors.add(key + ": missing");
                continue;
            }
            var actualType = Json.typeOf(object.get(key));
            if (!actualType.equals(expectedType)) {
                errors.add(key + ": expected " + expectedType + ", got " + actualType);
            }
        }
        if (errors.isEmpty()) {
            return pass("valid schema");
        }
        double valid = required.size() - errors.size();
        return score(valid / required.size(), String.join("; ", errors));
    }
}
