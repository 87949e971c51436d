package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Map;

/**
 * Cosine of the word-frequency vectors of output and expected.
 *
 * <p>Both empty scores 1.0; exactly one empty scores 0.0.
 */
public final class CosineSimilarity extends BaseMetric {
    private final boolean caseSensitive;

    public CosineSimilarity(boolean caseSensitive) {
        super("cosine_similarity");
        this.caseSensitive = caseSensitive;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        return score(similarity(input.output(), input.expected(), caseSensitive));
    }

    static double similarity(String s1, String s2, boolean caseSensitive) {
        var vec1 = Text.wordFrequency(Text.normalize(s1, caseSensitive));
        var vec2 = Text.wordFrequency(Text.normalize(s2, caseSensitive));
        if (vec1.isEmpty() || vec2.isEmpty()) {
            return vec1.isEmpty() && vec2.isEmpty() ? 1.0 : 0.0;
        }

        double dotProduct = 0;
        for (var entry : vec1.entrySet()) {
            var count2 = vec2.get(entry.getKey());
            if (count2 != null) {
                dotProduct += (double) entry.getValue() * count2;
            }
        }
        double magnitude = norm(vec1) * norm(vec2);
        if (magnitude == 0) {
            return 0.0;
        }
        return dotProduct / magnitude;
    }

    private static double norm(Map<String, Integer> vector) {
        double sumOfSquares = 0;
        for (int count : vector.values()) {
            sumOfSquares += (double) count * count;
        }
        return Math.sqrt(sumOfSquares);
    }
}
