package dev.evalkit.eval;

import dev.evalkit.json.EvalJsonMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Outcome of one metric applied to one input. */
public record ScoreResult(
        /** Name of the metric that produced this score. */
        @Nonnull String name,
        /**
         * Numeric score, typically between 0.0 and 1.0.
         *
         * <p>Unspecified when {@link #error()} is present.
         */
        double value,
        /** Optional explanation for the score. */
        @Nonnull Optional<String> reason,
        /** Additional information about the score. Empty when absent. */
        @Nonnull Map<String, Object> metadata,
        /** Set if the metric failed to compute a score. */
        @Nonnull Optional<Throwable> error) {

    public ScoreResult {
        Objects.requireNonNull(name);
        reason = Objects.requireNonNullElse(reason, Optional.empty());
        error = Objects.requireNonNullElse(error, Optional.empty());
        metadata =
                metadata == null || metadata.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ScoreResult of(String name, double value) {
        return new ScoreResult(name, value, Optional.empty(), Map.of(), Optional.empty());
    }

    public static ScoreResult of(String name, double value, @Nullable String reason) {
        return new ScoreResult(
                name, value, Optional.ofNullable(reason), Map.of(), Optional.empty());
    }

    public static ScoreResult failed(String name, Throwable error) {
        return new ScoreResult(
                name, 0.0, Optional.empty(), Map.of(), Optional.of(Objects.requireNonNull(error)));
    }

    /** 1.0 for {@code true}, 0.0 for {@code false}. */
    public static ScoreResult ofBoolean(String name, boolean value) {
        return of(name, value ? 1.0 : 0.0);
    }

    public static ScoreResult ofBoolean(String name, boolean value, @Nullable String reason) {
        return of(name, value ? 1.0 : 0.0, reason);
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }

    public ScoreResult withName(String name) {
        return new ScoreResult(name, value, reason, metadata, error);
    }

    public ScoreResult withValue(double value) {
        return new ScoreResult(name, value, reason, metadata, error);
    }

    public ScoreResult withReason(@Nullable String reason) {
        return new ScoreResult(name, value, Optional.ofNullable(reason), metadata, error);
    }

    public ScoreResult withMetadata(Map<String, Object> metadata) {
        return new ScoreResult(name, value, reason, metadata, error);
    }

    /** Serializes this score. The error, if any, is rendered as its message. */
    public String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("name", name);
        json.put("value", value);
        reason.ifPresent(r -> json.put("reason", r));
        if (!metadata.isEmpty()) {
            json.put("metadata", metadata);
        }
        error.ifPresent(e -> json.put("error", String.valueOf(e.getMessage())));
        return EvalJsonMapper.toJson(json);
    }

    @Override
    public String toString() {
        if (error.isPresent()) {
            return "%s: error - %s".formatted(name, error.get().getMessage());
        }
        if (reason.isPresent() && !reason.get().isEmpty()) {
            return String.format(Locale.ROOT, "%s: %.4f (%s)", name, value, reason.get());
        }
        return String.format(Locale.ROOT, "%s: %.4f", name, value);
    }
}
