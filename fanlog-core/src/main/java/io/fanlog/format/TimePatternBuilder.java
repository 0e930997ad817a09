package io.fanlog.format;

import io.fanlog.ConfigurationException;

/**
 * Fluent composer of {@link java.time.format.DateTimeFormatter} patterns.
 *
 * <pre>{@code
 * String pattern = new TimePatternBuilder()
 *     .day("/").month("/").year(" ")
 *     .hour(":").minute(":").second(".").millisecond(7)
 *     .toPattern();   // "dd/MM/yyyy HH:mm:ss.SSSSSSS"
 * }</pre>
 *
 * <p>Suffixes and literals are quoted when they contain pattern letters, so they render
 * verbatim. Not thread-safe.
 */
public final class TimePatternBuilder {
    private static final int MIN_FRACTION_DIGITS = 1;
    private static final int MAX_FRACTION_DIGITS = 7;

    private final StringBuilder pattern = new StringBuilder();

    public TimePatternBuilder year() {
        return year("");
    }

    public TimePatternBuilder year(String suffix) {
        return token("yyyy", suffix);
    }

    public TimePatternBuilder month() {
        return month("");
    }

    public TimePatternBuilder month(String suffix) {
        return token("MM", suffix);
    }

    public TimePatternBuilder day() {
        return day("");
    }

    public TimePatternBuilder day(String suffix) {
        return token("dd", suffix);
    }

    public TimePatternBuilder hour() {
        return hour("");
    }

    public TimePatternBuilder hour(String suffix) {
        return token("HH", suffix);
    }

    public TimePatternBuilder minute() {
        return minute("");
    }

    public TimePatternBuilder minute(String suffix) {
        return token("mm", suffix);
    }

    public TimePatternBuilder second() {
        return second("");
    }

    public TimePatternBuilder second(String suffix) {
        return token("ss", suffix);
    }

    /**
     * Appends milliseconds with three digits.
     *
     * @return this builder
     */
    public TimePatternBuilder millisecond() {
        return millisecond(3, "");
    }

    public TimePatternBuilder millisecond(int digits) {
        return millisecond(digits, "");
    }

    /**
     * Appends a fraction of second with the given number of digits.
     *
     * @param digits number of fraction digits, 1 to 7
     * @param suffix literal text appended after the token
     * @return this builder
     * @throws ConfigurationException if {@code digits} is outside 1..7
     */
    public TimePatternBuilder millisecond(int digits, String suffix) {
        if (digits < MIN_FRACTION_DIGITS || digits > MAX_FRACTION_DIGITS) {
            throw new ConfigurationException("The digits value is out of range ("
                    + MIN_FRACTION_DIGITS + "-" + MAX_FRACTION_DIGITS + "): " + digits);
        }
        return token("S".repeat(digits), suffix);
    }

    /**
     * Appends literal text.
     *
     * @param text text rendered verbatim
     * @return this builder
     */
    public TimePatternBuilder literal(String text) {
        pattern.append(quote(text));
        return this;
    }

    public TimePatternBuilder clear() {
        pattern.setLength(0);
        return this;
    }

    public String toPattern() {
        return pattern.toString();
    }

    @Override
    public String toString() {
        return toPattern();
    }

    private TimePatternBuilder token(String token, String suffix) {
        pattern.append(token);
        return literal(suffix);
    }

    static String quote(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        boolean reserved = text.chars().anyMatch(c -> Character.isLetter(c)
                || c == '\'' || c == '[' || c == ']' || c == '{' || c == '}' || c == '#');
        if (!reserved) {
            return text;
        }
        return "'" + text.replace("'", "''") + "'";
    }
}
