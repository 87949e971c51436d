package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.List;

/**
 * Simplified ROUGE-L: an F-score over the precision and recall of the longest common subsequence
 * of lower-cased whitespace tokens.
 *
 * <p>{@code beta} weights recall relative to precision. Both token lists empty scores 1.0, exactly
 * one empty scores 0.0.
 */
public final class RougeL extends BaseMetric {
    private final double beta;

    public RougeL() {
        this(1.0);
    }

    /** @param beta recall weight. Values of 0 or below select 1.0. */
    public RougeL(double beta) {
        super("rouge_l");
        this.beta = beta > 0 ? beta : 1.0;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var candidate = Text.words(Text.lower(input.output()));
        var reference = Text.words(Text.lower(input.expected()));
        return score(fScore(candidate, reference, beta));
    }

    public double getBeta() {
        return beta;
    }

    static double fScore(List<String> candidate, List<String> reference, double beta) {
        if (candidate.isEmpty() || reference.isEmpty()) {
            return candidate.isEmpty() && reference.isEmpty() ? 1.0 : 0.0;
        }
        int lcs = lcsLength(candidate, reference);
        double precision = (double) lcs / candidate.size();
        double recall = (double) lcs / reference.size();
        if (precision + recall == 0) {
            return 0.0;
        }
        double betaSq = beta * beta;
        return ((1 + betaSq) * precision * recall) / (betaSq * precision + recall);
    }

    static int lcsLength(List<String> a, List<String> b) {
        int[][] dp = new int[a.size() + 1][b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                if (a.get(i - 1).equals(b.get(j - 1))) {
                    dp[i][j] = dp[i - 1][j - 1] + 1;
                } else {
                    dp[i][j] = Math.max(dp[i - 1][j], dp[i][j - 1]);
                }
            }
        }
        return dp[a.size()][b.size()];
    }
}
