package dev.evalkit.eval;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/** All scores computed for a single evaluated item. */
public record EvaluationResult(
        /** identifier of the evaluated item */
        @Nonnull String itemId,
        /** the input that was evaluated */
        @Nonnull MetricInput input,
        /** scores in metric registration order */
        @Nonnull ScoreResults scores,
        /**
         * Set if the evaluation as a whole failed. Failed individual scores do not set this.
         */
        @Nonnull Optional<Throwable> error) {

    public EvaluationResult {
        itemId = Objects.requireNonNullElse(itemId, "");
        Objects.requireNonNull(input);
        scores = Objects.requireNonNullElse(scores, ScoreResults.empty());
        error = Objects.requireNonNullElse(error, Optional.empty());
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }

    /** Mean of the successful scores of this item. */
    public double averageScore() {
        return scores.average();
    }

    public EvaluationResult withItemId(String itemId) {
        return new EvaluationResult(itemId, input, scores, error);
    }
}
