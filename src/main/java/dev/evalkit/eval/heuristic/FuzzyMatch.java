package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/**
 * Mean of Levenshtein similarity and word-level Jaccard similarity.
 *
 * <p>The threshold only selects the reason; a score below it is still a successful score.
 */
public final class FuzzyMatch extends BaseMetric {
    static final String ABOVE_THRESHOLD = "fuzzy match above threshold";
    static final String BELOW_THRESHOLD = "fuzzy match below threshold";

    private final double threshold;
    private final boolean caseSensitive;

    public FuzzyMatch(double threshold, boolean caseSensitive) {
        super("fuzzy_match");
        this.threshold = threshold;
        this.caseSensitive = caseSensitive;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var s1 = Text.normalize(input.output(), caseSensitive);
        var s2 = Text.normalize(input.expected(), caseSensitive);

        double levenshtein = LevenshteinSimilarity.similarity(s1, s2, true);
        double jaccard = JaccardSimilarity.similarity(Text.wordSet(s1), Text.wordSet(s2));
        double average = (levenshtein + jaccard) / 2;

        return score(average, average >= threshold ? ABOVE_THRESHOLD : BELOW_THRESHOLD);
    }

    public double getThreshold() {
        return threshold;
    }
}
