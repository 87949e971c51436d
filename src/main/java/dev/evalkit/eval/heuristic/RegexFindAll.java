package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.regex.Pattern;

/**
 * Counts non-overlapping matches of a pattern in the output.
 *
 * <p>By default scores 1.0 when the count lies within {@code [minMatches, maxMatches]}, where a
 * {@code maxMatches} of 0 or below means no upper bound. With a positive {@code normalizeBy} the
 * score is instead {@code min(count / normalizeBy, 1.0)}.
 */
public final class RegexFindAll extends BaseMetric {
    private final Pattern pattern;
    private final int minMatches;
    private final int maxMatches;
    private final int normalizeBy;

    public RegexFindAll(String regex, int minMatches, int maxMatches) {
        this(regex, minMatches, maxMatches, 0);
    }

    /** @throws java.util.regex.PatternSyntaxException if {@code regex} is invalid */
    public RegexFindAll(String regex, int minMatches, int maxMatches, int normalizeBy) {
        super("regex_find_all");
        this.pattern = Pattern.compile(regex);
        this.minMatches = minMatches;
        this.maxMatches = maxMatches;
        this.normalizeBy = normalizeBy;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        long count = pattern.matcher(input.output()).results().count();
        if (normalizeBy > 0) {
            return score(Math.min((double) count / normalizeBy, 1.0));
        }
        if (count >= minMatches && (maxMatches <= 0 || count <= maxMatches)) {
            return pass("match count within range");
        }
        return fail("match count out of range");
    }
}
