package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Objects;
import java.util.function.BiPredicate;

/** Compares the output with the expected value: 1.0 on a match, 0.0 otherwise. */
public final class StringMatch extends BaseMetric {

    public enum Mode {
        EQUALS("equals", String::equals, "exact match", "no match"),
        CONTAINS(
                "contains",
                String::contains,
                "contains expected value",
                "does not contain expected value"),
        STARTS_WITH(
                "starts_with",
                String::startsWith,
                "starts with expected value",
                "does not start with expected value"),
        ENDS_WITH(
                "ends_with",
                String::endsWith,
                "ends with expected value",
                "does not end with expected value");

        private final String metricName;
        private final BiPredicate<String, String> test;
        private final String matchReason;
        private final String mismatchReason;

        Mode(
                String metricName,
                BiPredicate<String, String> test,
                String matchReason,
                String mismatchReason) {
            this.metricName = metricName;
            this.test = test;
            this.matchReason = matchReason;
            this.mismatchReason = mismatchReason;
        }
    }

    private final Mode mode;
    private final boolean caseSensitive;

    public StringMatch(Mode mode, boolean caseSensitive) {
        super(Objects.requireNonNull(mode).metricName);
        this.mode = mode;
        this.caseSensitive = caseSensitive;
    }

    public static StringMatch equalsMatch(boolean caseSensitive) {
        return new StringMatch(Mode.EQUALS, caseSensitive);
    }

    public static StringMatch contains(boolean caseSensitive) {
        return new StringMatch(Mode.CONTAINS, caseSensitive);
    }

    public static StringMatch startsWith(boolean caseSensitive) {
        return new StringMatch(Mode.STARTS_WITH, caseSensitive);
    }

    public static StringMatch endsWith(boolean caseSensitive) {
        return new StringMatch(Mode.ENDS_WITH, caseSensitive);
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var output = Text.normalize(input.output(), caseSensitive);
        var expected = Text.normalize(input.expected(), caseSensitive);
        if (mode.test.test(output, expected)) {
            return pass(mode.matchReason);
        }
        return fail(mode.mismatchReason);
    }

    public Mode getMode() {
        return mode;
    }
}
