package io.fanlog.format;

import java.util.Map;

/**
 * A command with text and bound parameters, such as a parameterized SQL statement.
 *
 * <p>{@link DefaultMessageFormatter} renders the kind, the text and one line per parameter,
 * in the iteration order of {@link #parameters()}.
 */
public interface StructuredCommand {

    /**
     * @return the kind of command, e.g. {@code "Text"} or {@code "StoredProcedure"}
     */
    String kind();

    /**
     * @return the literal command text
     */
    String text();

    /**
     * @return bound parameters by name, in binding order
     */
    Map<String, Object> parameters();
}
