package io.fanlog.util;

import io.fanlog.ConfigurationException;

/**
 * Argument checks that fail with {@link ConfigurationException}.
 */
public final class Arguments {

    private Arguments() {
    }

    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new ConfigurationException(name + " must not be null");
        }
        return value;
    }

    public static String requireNonEmpty(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException(name + " must not be null or empty");
        }
        return value;
    }

    public static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new ConfigurationException(name + " must be >= 0");
        }
        return value;
    }
}
