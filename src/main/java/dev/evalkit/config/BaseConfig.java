package dev.evalkit.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class for environment-driven configuration.
 *
 * <p>Values are resolved from explicit overrides first, then from the process environment, then
 * from the supplied default.
 */
abstract class BaseConfig {
    private final Map<String, String> envOverrides;

    protected BaseConfig(@Nonnull Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(Objects.requireNonNull(envOverrides));
    }

    protected boolean getConfig(String settingName, boolean defaultValue) {
        return getConfig(settingName, defaultValue, Boolean.class);
    }

    protected int getConfig(String settingName, int defaultValue) {
        return getConfig(settingName, defaultValue, Integer.class);
    }

    protected double getConfig(String settingName, double defaultValue) {
        return getConfig(settingName, defaultValue, Double.class);
    }

    protected <T> T getConfig(String settingName, @Nonnull T defaultValue, Class<T> type) {
        var rawValue = lookup(settingName);
        if (rawValue == null) {
            return defaultValue;
        }
        return parse(settingName, rawValue, type);
    }

    @Nullable
    private String lookup(String settingName) {
        if (envOverrides.containsKey(settingName)) {
            return envOverrides.get(settingName);
        }
        return System.getenv(settingName);
    }

    private static <T> T parse(String settingName, String rawValue, Class<T> type) {
        try {
            Object parsed;
            if (type == Boolean.class) {
                parsed = parseBoolean(rawValue.trim());
            } else if (type == Integer.class) {
                parsed = Integer.parseInt(rawValue.trim());
            } else if (type == Double.class) {
                parsed = Double.parseDouble(rawValue.trim());
            } else {
                throw new IllegalArgumentException("unsupported config type: " + type.getName());
            }
            return type.cast(parsed);
        } catch (IllegalArgumentException e) {
            throw new RuntimeException(
                    "invalid value for %s: '%s'".formatted(settingName, rawValue), e);
        }
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("not a boolean: " + value);
    }
}
