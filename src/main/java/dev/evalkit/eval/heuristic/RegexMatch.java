package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.regex.Pattern;

/** 1.0 if the pattern is found anywhere in the output. */
public final class RegexMatch extends BaseMetric {
    private final Pattern pattern;

    /** @throws java.util.regex.PatternSyntaxException if {@code regex} is invalid */
    public RegexMatch(String regex) {
        super("regex_match");
        this.pattern = Pattern.compile(regex);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        if (pattern.matcher(input.output()).find()) {
            return pass("matches pattern");
        }
        return fail("does not match pattern");
    }
}
