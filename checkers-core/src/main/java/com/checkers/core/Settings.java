package com.checkers.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Reads configuration values from a system property, falling back to an environment variable and
 * then to a default.
 */
public final class Settings {

    private Settings() {
    }

    public static String read(String property, String environmentVariable, String defaultValue) {
        Objects.requireNonNull(property, "property");
        String value = System.getProperty(property);
        if (value == null || value.trim().isEmpty()) {
            value = environmentVariable == null ? null : System.getenv(environmentVariable);
        }
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    public static int readInt(String property, String environmentVariable, int defaultValue) {
        String value = read(property, environmentVariable, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting " + property + " is not an integer: " + value, ex);
        }
    }

    public static long readLong(String property, String environmentVariable, long defaultValue) {
        String value = read(property, environmentVariable, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting " + property + " is not a number: " + value, ex);
        }
    }

    /**
     * Reads an enum constant by name; case and dashes are ignored.
     */
    public static <E extends Enum<E>> E readEnum(String property, String environmentVariable, Class<E> type,
            E defaultValue) {
        String value = read(property, environmentVariable, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Setting " + property + " has unknown value: " + value, ex);
        }
    }
}
