package io.fanlog.jdbc;

import io.fanlog.format.StructuredCommand;
import io.fanlog.util.Arguments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A SQL statement with named parameters, bound positionally in insertion order.
 *
 * <p>Logging a {@code SqlCommand} renders its type, text and parameters through
 * {@link io.fanlog.format.DefaultMessageFormatter}, which makes it handy for tracing the
 * statements an application issues.
 *
 * <pre>{@code
 * SqlCommand insert = SqlCommand.text("INSERT INTO users (id, name) VALUES (?, ?)")
 *     .parameter("id", 7)
 *     .parameter("name", "bob")
 *     .build();
 * log.debug(insert);
 * }</pre>
 */
public final class SqlCommand implements StructuredCommand {
    public static final String TEXT = "Text";
    public static final String STORED_PROCEDURE = "StoredProcedure";

    private final String kind;
    private final String text;
    private final Map<String, Object> parameters;

    private SqlCommand(Builder builder) {
        this.kind = builder.kind;
        this.text = builder.text;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    public static Builder text(String sql) {
        return new Builder(TEXT, sql);
    }

    public static Builder storedProcedure(String call) {
        return new Builder(STORED_PROCEDURE, call);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public Map<String, Object> parameters() {
        return parameters;
    }

    /**
     * @return parameter values in binding order
     */
    public Object[] values() {
        List<Object> values = new ArrayList<>(parameters.values());
        return values.toArray();
    }

    @Override
    public String toString() {
        return kind + ": " + text;
    }

    /** Builder for {@link SqlCommand}. */
    public static final class Builder {
        private final String kind;
        private final String text;
        private final Map<String, Object> parameters = new LinkedHashMap<>();

        private Builder(String kind, String text) {
            this.kind = kind;
            this.text = Arguments.requireNonEmpty(text, "text");
        }

        /**
         * Adds the next positional parameter. A repeated name replaces the earlier value
         * in place.
         *
         * @param name  parameter name, used when the command is logged
         * @param value parameter value, may be null
         * @return this builder
         */
        public Builder parameter(String name, Object value) {
            parameters.put(Arguments.requireNonEmpty(name, "name"), value);
            return this;
        }

        public SqlCommand build() {
            return new SqlCommand(this);
        }
    }
}
