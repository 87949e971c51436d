package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/** 1.0 if the output is a JSON number. */
public final class IsNumber extends BaseMetric {

    public IsNumber() {
        super("is_number");
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        if (Json.parse(input.output()).filter(n -> n.isNumber()).isPresent()) {
            return pass("valid number");
        }
        return fail("not a valid number");
    }
}
