package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.Metric;
import dev.evalkit.eval.ScoreResult;
import java.util.Objects;

/** Common base for the heuristic metrics: a fixed name plus scoring helpers. */
abstract class BaseMetric implements Metric {
    private final String name;

    protected BaseMetric(String name) {
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public final String getName() {
        return name;
    }

    protected ScoreResult score(double value) {
        return ScoreResult.of(name, value);
    }

    protected ScoreResult score(double value, String reason) {
        return ScoreResult.of(name, value, reason);
    }

    protected ScoreResult pass(String reason) {
        return ScoreResult.of(name, 1.0, reason);
    }

    protected ScoreResult fail(String reason) {
        return ScoreResult.of(name, 0.0, reason);
    }
}
