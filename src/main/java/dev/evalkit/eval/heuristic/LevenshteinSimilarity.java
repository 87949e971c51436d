package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/**
 * Similarity of output and expected derived from their edit distance: {@code 1 - distance /
 * max(length)}, measured in Unicode code points. Two empty strings score 1.0.
 */
public final class LevenshteinSimilarity extends BaseMetric {
    private final boolean caseSensitive;

    public LevenshteinSimilarity(boolean caseSensitive) {
        super("levenshtein_similarity");
        this.caseSensitive = caseSensitive;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        return score(similarity(input.output(), input.expected(), caseSensitive));
    }

    static double similarity(String s1, String s2, boolean caseSensitive) {
        int[] a = Text.normalize(s1, caseSensitive).codePoints().toArray();
        int[] b = Text.normalize(s2, caseSensitive).codePoints().toArray();
        int maxLen = Math.max(a.length, b.length);
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) distance(a, b) / maxLen;
    }

    static int distance(int[] a, int[] b) {
        if (a.length == 0) {
            return b.length;
        }
        if (b.length == 0) {
            return a.length;
        }
        // two rolling rows of the edit-distance matrix
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            current[0] = i;
            for (int j = 1; j <= b.length; j++) {
                int cost = a[i - 1] == b[j - 1] ? 0 : 1;
                current[j] =
                        Math.min(
                                Math.min(previous[j] + 1, current[j - 1] + 1),
                                previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length];
    }
}
