package dev.evalkit.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The values a metric scores: the model input, the model output, an optional reference answer
 * and any context the model was given.
 *
 * <p>Instances are immutable. Every {@code with*} method returns a modified copy, so a single
 * input may be shared between concurrently running evaluations.
 */
@Immutable
public record MetricInput(
        /** input sent to the model */
        @Nonnull String input,
        /** output produced by the model */
        @Nonnull String output,
        /** reference output, for comparison metrics */
        @Nonnull String expected,
        /** additional context provided to the model */
        @Nonnull String context,
        /** arbitrary extra values. Null values are permitted. */
        @Nonnull Map<String, Object> metadata) {

    private static final MetricInput EMPTY = new MetricInput("", "", "", "", Map.of());

    public MetricInput {
        input = Objects.requireNonNullElse(input, "");
        output = Objects.requireNonNullElse(output, "");
        expected = Objects.requireNonNullElse(expected, "");
        context = Objects.requireNonNullElse(context, "");
        metadata = copyOf(metadata);
    }

    public static MetricInput empty() {
        return EMPTY;
    }

    public static MetricInput of(String input, String output) {
        return new MetricInput(input, output, "", "", Map.of());
    }

    public MetricInput withInput(String input) {
        return new MetricInput(input, output, expected, context, metadata);
    }

    public MetricInput withOutput(String output) {
        return new MetricInput(input, output, expected, context, metadata);
    }

    public MetricInput withExpected(String expected) {
        return new MetricInput(input, output, expected, context, metadata);
    }

    public MetricInput withContext(String context) {
        return new MetricInput(input, output, expected, context, metadata);
    }

    /** Returns a copy with {@code key} set to {@code value}, replacing any previous value. */
    public MetricInput withMetadata(String key, @Nullable Object value) {
        var copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new MetricInput(input, output, expected, context, copy);
    }

    /** Returns a copy whose metadata is replaced by {@code metadata}. */
    public MetricInput withMetadata(Map<String, Object> metadata) {
        return new MetricInput(input, output, expected, context, metadata);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /** The metadata value at {@code key} if it is a string, otherwise the empty string. */
    public String getString(String key) {
        return metadata.get(key) instanceof String s ? s : "";
    }

    /**
     * The metadata value at {@code key} as a list of strings. Non-string elements are skipped;
     * a missing or non-list value yields an empty list.
     */
    public List<String> getStringList(String key) {
        if (!(metadata.get(key) instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    private static Map<String, Object> copyOf(@Nullable Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
