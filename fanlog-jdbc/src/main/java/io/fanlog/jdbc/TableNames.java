package io.fanlog.jdbc;

import io.fanlog.ConfigurationException;
import io.fanlog.util.Arguments;

/**
 * Table name validation for the tabular store.
 */
public final class TableNames {
    public static final String DEFAULT_TABLE = "LogEntries";
    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {
    }

    public static String validate(String tableName) {
        Arguments.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new ConfigurationException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
