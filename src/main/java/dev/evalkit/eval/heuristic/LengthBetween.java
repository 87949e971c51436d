package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/** 1.0 if the output length in code points lies within {@code [min, max]}. */
public final class LengthBetween extends BaseMetric {
    private final int min;
    private final int max;

    public LengthBetween(int min, int max) {
        super("length_between");
        this.min = min;
        this.max = max;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        int length = Text.codePointLength(input.output());
        if (length >= min && length <= max) {
            return pass("length within range");
        }
        return fail("length out of range: " + length);
    }
}
