package io.fanlog;

import java.util.Locale;

/**
 * Severity levels of a log entry, in ascending order of importance.
 *
 * <p>The declaration order is the rank used by every filtering comparison:
 * {@code DEBUG < INFO < WARN < ERROR < CRITICAL}.
 */
public enum Severity {

    /**
     * Interactive investigation during development; no long-term value.
     */
    DEBUG("Debug", "DBG", Category.INFORMATIONAL),

    /**
     * General flow of the application.
     */
    INFO("Info", "INF", Category.INFORMATIONAL),

    /**
     * Abnormal or unexpected events that do not stop the application.
     */
    WARN("Warn", "WRN", Category.WARNING),

    /**
     * Failure of the current activity, not of the whole application.
     */
    ERROR("Error", "ERR", Category.ERROR),

    /**
     * Unrecoverable failure that requires immediate attention.
     */
    CRITICAL("Critical", "CRT", Category.ERROR);

    private final String displayName;
    private final String shortCode;
    private final Category category;

    Severity(String displayName, String shortCode, Category category) {
        this.displayName = displayName;
        this.shortCode = shortCode;
        this.category = category;
    }

    public int rank() {
        return ordinal();
    }

    /**
     * Three-character code rendered between brackets in a formatted line.
     *
     * @return the short code, e.g. {@code "WRN"}
     */
    public String shortCode() {
        return shortCode;
    }

    /**
     * Coarse category used by event-log style sinks.
     *
     * @return the category for this level
     */
    public Category category() {
        return category;
    }

    /**
     * Human-readable name stored by tabular sinks, e.g. {@code "Error"}.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns whether this level ranks at or above {@code threshold}.
     *
     * @param threshold the minimum level
     * @return {@code true} if this level passes the threshold
     */
    public boolean isAtLeast(Severity threshold) {
        return rank() >= threshold.rank();
    }

    /**
     * Parses a level from its name or its short code, ignoring case.
     *
     * @param value e.g. {@code "warn"}, {@code "WRN"} or {@code "Critical"}
     * @return the matching severity
     * @throws ConfigurationException if {@code value} matches no level
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("severity must not be empty");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized) || severity.shortCode.equals(normalized)) {
                return severity;
            }
        }
        throw new ConfigurationException("Unknown severity: " + value);
    }

    /**
     * Coarse grouping of severities.
     */
    public enum Category {
        INFORMATIONAL,
        WARNING,
        ERROR
    }
}
