package dev.evalkit.eval;

import java.util.Objects;
import java.util.function.BiFunction;

/** A metric backed by an arbitrary scoring function. */
public final class MetricFunction implements Metric {
    private final String name;
    private final BiFunction<EvalContext, MetricInput, ScoreResult> scoreFn;

    public MetricFunction(String name, BiFunction<EvalContext, MetricInput, ScoreResult> scoreFn) {
        this.name = Objects.requireNonNull(name);
        this.scoreFn = Objects.requireNonNull(scoreFn);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        return scoreFn.apply(ctx, input);
    }
}
