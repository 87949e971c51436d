package dev.evalkit.config;

import java.util.HashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Configuration for the evaluation engine and the default heuristic metrics.
 *
 * <p>Most users will configure everything through envars. Any envar can also be overridden during
 * config construction.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@ToString
public final class EvalConfig extends BaseConfig {
    /** Maximum number of items evaluated at once. Values below 1 leave the engine default. */
    private final int concurrency = getConfig("EVALKIT_CONCURRENCY", 1);

    private final double fuzzyThreshold = getConfig("EVALKIT_FUZZY_THRESHOLD", 0.8);
    private final int bleuMaxN = getConfig("EVALKIT_BLEU_MAX_N", 4);
    private final double rougeBeta = getConfig("EVALKIT_ROUGE_BETA", 1.0);
    private final boolean caseSensitive = getConfig("EVALKIT_CASE_SENSITIVE", false);
    private final boolean debug = getConfig("EVALKIT_DEBUG", false);

    public static EvalConfig fromEnvironment() {
        return of();
    }

    public static EvalConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new RuntimeException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new EvalConfig(overridesMap);
    }

    private EvalConfig(Map<String, String> envOverrides) {
        super(envOverrides);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder concurrency(int value) {
            envOverrides.put("EVALKIT_CONCURRENCY", String.valueOf(value));
            return this;
        }

        public Builder fuzzyThreshold(double value) {
            envOverrides.put("EVALKIT_FUZZY_THRESHOLD", String.valueOf(value));
            return this;
        }

        public Builder bleuMaxN(int value) {
            envOverrides.put("EVALKIT_BLEU_MAX_N", String.valueOf(value));
            return this;
        }

        public Builder rougeBeta(double value) {
            envOverrides.put("EVALKIT_ROUGE_BETA", String.valueOf(value));
            return this;
        }

        public Builder caseSensitive(boolean value) {
            envOverrides.put("EVALKIT_CASE_SENSITIVE", String.valueOf(value));
            return this;
        }

        public Builder debug(boolean value) {
            envOverrides.put("EVALKIT_DEBUG", String.valueOf(value));
            return this;
        }

        public EvalConfig build() {
            return new EvalConfig(envOverrides);
        }
    }
}
