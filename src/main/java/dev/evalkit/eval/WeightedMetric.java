package dev.evalkit.eval;

import java.util.Objects;

/** Scales the score of another metric. Failed scores pass through without weighting. */
public final class WeightedMetric implements Metric {
    private final Metric metric;
    private final double weight;

    public WeightedMetric(Metric metric, double weight) {
        this.metric = Objects.requireNonNull(metric);
        this.weight = weight;
    }

    /** The wrapped metric's name. */
    @Override
    public String getName() {
        return metric.getName();
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        var result = metric.score(ctx, input);
        if (!result.isSuccess()) {
            return result;
        }
        return result.withValue(result.value() * weight);
    }

    public double getWeight() {
        return weight;
    }
}
