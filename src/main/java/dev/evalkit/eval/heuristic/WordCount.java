package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/** 1.0 if the number of whitespace-separated words in the output lies within {@code [min, max]}. */
public final class WordCount extends BaseMetric {
    private final int min;
    private final int max;

    public WordCount(int min, int max) {
        super("word_count");
        this.min = min;
        this.max = max;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        int count = Text.words(input.output()).size();
        if (count >= min && count <= max) {
            return pass("word count within range");
        }
        return fail("word count out of range");
    }
}
