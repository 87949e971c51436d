package dev.evalkit.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines several metrics into one score: the mean of the children that succeeded.
 *
 * <p>Failed children are left out of the mean. A child that throws a {@link RuntimeException} or
 * returns null counts as failed. If every child fails the composite scores 0; the composite
 * itself never fails.
 */
public final class CompositeMetric implements Metric {
    private final String name;
    private final List<Metric> metrics;

    public CompositeMetric(String name, Metric... metrics) {
        this(name, List.of(metrics));
    }

    public CompositeMetric(String name, List<Metric> metrics) {
        this.name = Objects.requireNonNull(name);
        this.metrics = List.copyOf(metrics);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        return ScoreResult.of(name, scoreAll(ctx, input).average());
    }

    /** Scores every child in registration order and returns the raw per-child results. */
    public ScoreResults scoreAll(EvalContext ctx, MetricInput input) {
        List<ScoreResult> scores = new ArrayList<>(metrics.size());
        for (var metric : metrics) {
            scores.add(scoreChild(metric, ctx, input));
        }
        return new ScoreResults(scores);
    }

    private static ScoreResult scoreChild(Metric metric, EvalContext ctx, MetricInput input) {
        try {
            return Objects.requireNonNull(
                    metric.score(ctx, input),
                    "metric '%s' returned no score".formatted(metric.getName()));
        } catch (RuntimeException e) {
            return ScoreResult.failed(metric.getName(), e);
        }
    }

    public List<Metric> getMetrics() {
        return metrics;
    }
}
