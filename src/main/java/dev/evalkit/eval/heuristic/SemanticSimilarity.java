package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;

/**
 * Placeholder for embedding-based semantic similarity.
 *
 * <p>Until an embedding backend is available this reports case-insensitive word-based cosine
 * similarity, and says so in the reason.
 */
// TODO: accept an embedding function and compare embedding vectors when one is supplied
public final class SemanticSimilarity extends BaseMetric {
    static final String APPROXIMATION_REASON =
            "using word-based approximation (no embedding provider)";

    public SemanticSimilarity() {
        super("semantic_similarity");
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        return score(
                CosineSimilarity.similarity(input.output(), input.expected(), false),
                APPROXIMATION_REASON);
    }
}
