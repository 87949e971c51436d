package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.Set;

/**
 * Intersection over union of the distinct tokens of output and expected. Tokens are either
 * whitespace-separated words or single characters. Two empty token sets score 1.0.
 */
public final class JaccardSimilarity extends BaseMetric {
    private final boolean caseSensitive;
    private final boolean useWords;

    public JaccardSimilarity(boolean caseSensitive, boolean useWords) {
        super("jaccard_similarity");
        this.caseSensitive = caseSensitive;
        this.useWords = useWords;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var s1 = Text.normalize(input.output(), caseSensitive);
        var s2 = Text.normalize(input.expected(), caseSensitive);
        if (useWords) {
            return score(similarity(Text.wordSet(s1), Text.wordSet(s2)));
        }
        return score(similarity(Text.charSet(s1), Text.charSet(s2)));
    }

    static double similarity(Set<String> set1, Set<String> set2) {
        if (set1.isEmpty() && set2.isEmpty()) {
            return 1.0;
        }
        long intersection = set1.stream().filter(set2::contains).count();
        long union = set1.size() + set2.size() - intersection;
        return (double) intersection / union;
    }
}
