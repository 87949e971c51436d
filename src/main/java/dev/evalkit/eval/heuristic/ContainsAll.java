package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Fraction of the given values found in the output. The reason lists the missing values when
 * some are absent.
 */
public final class ContainsAll extends BaseMetric {
    private final List<String> values;
    private final boolean caseSensitive;

    public ContainsAll(List<String> values, boolean caseSensitive) {
        super("contains_all");
        this.values = List.copyOf(values);
        this.caseSensitive = caseSensitive;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var output = Text.normalize(input.output(), caseSensitive);
        List<String> missing = new ArrayList<>();
        for (var value : values) {
            if (!output.contains(Text.normalize(value, caseSensitive))) {
                missing.add(value);
            }
        }
        if (missing.isEmpty()) {
            return pass("contains all expected values");
        }
        double found = values.size() - missing.size();
        return score(found / values.size(), "missing: " + String.join(", ", missing));
    }
}
