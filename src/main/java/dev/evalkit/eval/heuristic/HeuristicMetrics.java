package dev.evalkit.eval.heuristic;

import dev.evalkit.config.EvalConfig;
import dev.evalkit.eval.Metric;
import java.util.List;

/** Ready-made metric suites. */
public final class HeuristicMetrics {
    private HeuristicMetrics() {}

    /** The text-similarity metrics, configured from {@code config}. */
    public static List<Metric> similarity(EvalConfig config) {
        var caseSensitive = config.caseSensitive();
        return List.of(
                new LevenshteinSimilarity(caseSensitive),
                new JaccardSimilarity(caseSensitive, true),
                new CosineSimilarity(caseSensitive),
                new Bleu(config.bleuMaxN()),
                new RougeL(config.rougeBeta()),
                new FuzzyMatch(config.fuzzyThreshold(), caseSensitive),
                new SemanticSimilarity());
    }
}
