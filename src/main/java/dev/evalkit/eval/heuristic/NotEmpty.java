package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/** 1.0 if the output has any non-whitespace content. */
public final class NotEmpty extends BaseMetric {

    public NotEmpty() {
        super("not_empty");
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        if (!input.output().isBlank()) {
            return pass("output is not empty");
        }
        return fail("output is empty");
    }
}
