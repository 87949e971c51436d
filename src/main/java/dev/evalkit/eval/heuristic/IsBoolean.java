package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Set;

/** 1.0 if the output is true/false, yes/no or 1/0, ignoring case and surrounding whitespace. */
public final class IsBoolean extends BaseMetric {
    private static final Set<String> BOOLEANS = Set.of("true", "false", "yes", "no", "1", "0");

    public IsBoolean() {
        super("is_boolean");
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var value = Text.lower(input.output().strip());
        if (BOOLEANS.contains(value)) {
            return pass("valid boolean: " + value);
        }
        return fail("not a valid boolean");
    }
}
