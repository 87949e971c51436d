package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Objects;

/** 1.0 if the output parses as JSON of the required kind. */
public final class IsJson extends BaseMetric {

    public enum Kind {
        /** any JSON value */
        ANY("is_json"),
        OBJECT("is_json_object"),
        ARRAY("is_json_array");

        private final String metricName;

        Kind(String metricName) {
            this.metricName = metricName;
        }
    }

    private final Kind kind;

    public IsJson() {
        this(Kind.ANY);
    }

    public IsJson(Kind kind) {
        super(Objects.requireNonNull(kind).metricName);
        this.kind = kind;
    }

    public static IsJson object() {
        return new IsJson(Kind.OBJECT);
    }

    public static IsJson array() {
        return new IsJson(Kind.ARRAY);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        switch (kind) {
            case OBJECT:
                return Json.parse(input.output()).filter(n -> n.isObject()).isPresent()
                        ? pass("valid JSON object")
                        : fail("not a valid JSON object");
            case ARRAY:
                return Json.parse(input.output()).filter(n -> n.isArray()).isPresent()
                        ? pass("valid JSON array")
                        : fail("not a valid JSON array");
            default:
                var error = Json.parseError(input.output());
                return error.isEmpty() ? pass("valid JSON") : fail("invalid JSON: " + error.get());
        }
    }
}
