package dev.evalkit.eval;

import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * A metric scores a single {@link MetricInput}.
 *
 * <p>Metrics signal failure by returning a {@link ScoreResult#failed failed} score rather than
 * throwing. Failed scores are excluded from every average.
 */
public interface Metric {
    String getName();

    ScoreResult score(EvalContext ctx, MetricInput input);

    static Metric of(
            String metricName, BiFunction<EvalContext, MetricInput, ScoreResult> scoreFn) {
        return new MetricFunction(metricName, scoreFn);
    }

    static Metric of(String metricName, ToDoubleFunction<MetricInput> scoreFn) {
        return new MetricFunction(
                metricName,
                (ctx, input) -> ScoreResult.of(metricName, scoreFn.applyAsDouble(input)));
    }

    /** Average of the successful scores of {@code metrics}, reported under {@code name}. */
    static CompositeMetric composite(String name, Metric... metrics) {
        return new CompositeMetric(name, metrics);
    }

    /** Score {@code metric} only for inputs matching {@code condition}. */
    static ConditionalMetric conditional(
            String name, Predicate<MetricInput> condition, Metric metric) {
        return new ConditionalMetric(name, condition, metric);
    }

    static WeightedMetric weighted(Metric metric, double weight) {
        return new WeightedMetric(metric, weight);
    }
}
