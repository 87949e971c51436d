package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.List;

/** 1.0 if the output contains at least one of the given values. */
public final class ContainsAny extends BaseMetric {
    private final List<String> values;
    private final boolean caseSensitive;

    public ContainsAny(List<String> values, boolean caseSensitive) {
        super("contains_any");
        this.values = List.copyOf(values);
        this.caseSensitive = caseSensitive;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var output = Text.normalize(input.output(), caseSensitive);
        for (var value : values) {
            if (output.contains(Text.normalize(value, caseSensitive))) {
                return pass("contains: " + value);
            }
        }
        return fail("does not contain any expected value");
    }
}
