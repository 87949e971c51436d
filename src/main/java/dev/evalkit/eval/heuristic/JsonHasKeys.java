package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.ArrayList;
import java.util.List;

/** Fraction of the required top-level keys present in the JSON object output. */
public final class JsonHasKeys extends BaseMetric {
    private final List<String> keys;

    public JsonHasKeys(List<String> keys) {
        super("json_has_keys");
        this.keys = List.copyOf(keys);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var parsed = Json.parse(input.output()).filter(n -> n.isObject());
        if (parsed.isEmpty()) {
            return fail("not a valid JSON object");
        }
        var object = parsed.get();
        List<String> missing = new ArrayList<>();
        for (var key : keys) {
            if (!object.has(key)) {
                missing.add(key);
            }
        }
        if (missing.isEmpty()) {
            return pass("has all required keys");
        }
        double found = keys.size() - missing.size();
        return score(found / keys.size(), "missing keys: " + String.join(", ", missing));
    }
}
