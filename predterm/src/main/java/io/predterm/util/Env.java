package io.predterm.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Configuration lookups. An environment variable wins over a system property
 * of the same name; blank values count as unset.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    public static double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::valueOf);
    }

    /**
     * "true" (any case) or "1" is true, anything else false.
     */
    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    // Unparseable numbers fall back to the default with a warning.
    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] Ignoring {}='{}' ({}), using {}", key, value, e.getMessage(), defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
