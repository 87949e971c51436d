package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplified BLEU: brevity penalty times the geometric mean of clipped n-gram precisions for n =
 * 1..maxN, over lower-cased whitespace tokens.
 *
 * <p>A zero precision is smoothed to {@value #SMOOTHING_FLOOR} before taking the logarithm. An
 * empty candidate scores 0.0.
 */
public final class Bleu extends BaseMetric {
    public static final int DEFAULT_MAX_N = 4;
    static final double SMOOTHING_FLOOR = 0.01;

    private final int maxN;

    public Bleu() {
        this(DEFAULT_MAX_N);
    }

    /** @param maxN largest n-gram order. Values below 1 select {@value #DEFAULT_MAX_N}. */
    public Bleu(int maxN) {
        super("bleu");
        this.maxN = maxN > 0 ? maxN : DEFAULT_MAX_N;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var candidate = Text.words(Text.lower(input.output()));
        var reference = Text.words(Text.lower(input.expected()));
        if (candidate.isEmpty()) {
            return score(0.0);
        }

        double logPrecisionSum = 0;
        for (int n = 1; n <= maxN; n++) {
            double precision = ngramPrecision(candidate, reference, n);
            logPrecisionSum += Math.log(precision > 0 ? precision : SMOOTHING_FLOOR);
        }
        double bp = brevityPenalty(candidate.size(), reference.size());
        return score(bp * Math.exp(logPrecisionSum / maxN));
    }

    public int getMaxN() {
        return maxN;
    }

    static double brevityPenalty(int candidateLength, int referenceLength) {
        if (candidateLength >= referenceLength) {
            return 1.0;
        }
        return Math.exp(1.0 - (double) referenceLength / candidateLength);
    }

    /** Fraction of candidate n-grams found in the reference, clipped to reference counts. */
    static double ngramPrecision(List<String> candidate, List<String> reference, int n) {
        if (candidate.size() < n || reference.size() < n) {
            return 0.0;
        }
        var candidateCounts = ngramCounts(candidate, n);
        var referenceCounts = ngramCounts(reference, n);
        int matches = 0;
        for (var entry : candidateCounts.entrySet()) {
            matches += Math.min(entry.getValue(), referenceCounts.getOrDefault(entry.getKey(), 0));
        }
        return (double) matches / (candidate.size() - n + 1);
    }

    private static Map<List<String>, Integer> ngramCounts(List<String> words, int n) {
        Map<List<String>, Integer> counts = new HashMap<>();
        for (int i = 0; i + n <= words.size(); i++) {
            counts.merge(List.copyOf(words.subList(i, i + n)), 1, Integer::sum);
        }
        return counts;
    }
}
