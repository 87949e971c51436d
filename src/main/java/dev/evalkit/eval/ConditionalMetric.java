package dev.evalkit.eval;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Delegates to another metric only when a condition holds.
 *
 * <p>When the condition fails the wrapped metric is not invoked and a zero score is reported under
 * this metric's own name. When it holds, the wrapped metric's result is returned as is, under the
 * wrapped metric's name.
 */
public final class ConditionalMetric implements Metric {
    static final String CONDITION_NOT_MET = "condition not met";

    private final String name;
    private final Predicate<MetricInput> condition;
    private final Metric metric;

    public ConditionalMetric(String name, Predicate<MetricInput> condition, Metric metric) {
        this.name = Objects.requireNonNull(name);
        this.condition = Objects.requireNonNull(condition);
        this.metric = Objects.requireNonNull(metric);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        if (!condition.test(input)) {
            return ScoreResult.of(name, 0.0, CONDITION_NOT_MET);
        }
        return metric.score(ctx, input);
    }
}
