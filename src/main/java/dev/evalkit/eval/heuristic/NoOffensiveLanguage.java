package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.List;

/** 0.0 if the output contains any of the given patterns, compared case-insensitively. */
public final class NoOffensiveLanguage extends BaseMetric {
    private final List<String> patterns;

    public NoOffensiveLanguage(List<String> patterns) {
        super("no_offensive_language");
        this.patterns = patterns.stream().map(Text::lower).toList();
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var output = Text.lower(input.output());
        for (var pattern : patterns) {
            if (output.contains(pattern)) {
                return fail("contains offensive pattern");
            }
        }
        return pass("no offensive language detected");
    }
}
