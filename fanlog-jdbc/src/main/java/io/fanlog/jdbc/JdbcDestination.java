package io.fanlog.jdbc;

import io.fanlog.ConfigurationException;
import io.fanlog.LogEntry;
import io.fanlog.ProcessIdentity;
import io.fanlog.Severity;
import io.fanlog.destination.AbstractDestination;
import io.fanlog.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Inserts one row per entry into a relational table.
 *
 * <p>Row layout, with the default table name {@value TableNames#DEFAULT_TABLE}:
 * <pre>
 * App, Machine, Username  process identity
 * Timestamp               entry time
 * Level                   severity display name, e.g. "Error"
 * Category                always NULL
 * Message                 formatted body
 * </pre>
 *
 * <p>Each write borrows a connection from the {@link ConnectionProvider} and closes it
 * afterwards. Connectivity failures are discarded like any other destination failure.
 *
 * <pre>{@code
 * JdbcDestination db = JdbcDestination.builder("DB")
 *     .dataSource(dataSource)
 *     .build();
 * }</pre>
 */
public final class JdbcDestination extends AbstractDestination {
    private final ConnectionProvider connectionProvider;
    private final String tableName;
    private final String insertSql;

    private JdbcDestination(Builder builder) {
        super(builder.identifier, builder.minimumLevel);
        if (builder.connectionProvider == null) {
            throw new ConfigurationException(
                    "connectionDescriptor, dataSource or connectionProvider is required: " + builder.identifier);
        }
        this.connectionProvider = builder.connectionProvider;
        this.tableName = TableNames.validate(builder.tableName);
        this.insertSql = "INSERT INTO " + tableName
                + " (App, Machine, Username, Timestamp, Level, Category, Message)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?)";
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public String tableName() {
        return tableName;
    }

    @Override
    protected void append(LogEntry entry) throws SQLException {
        SqlCommand insert = insertCommand(entry);
        try (Connection conn = connectionProvider.getConnection()) {
            JdbcTemplate.update(conn, insert);
        }
    }

    SqlCommand insertCommand(LogEntry entry) {
        ProcessIdentity identity = entry.identity();
        return SqlCommand.text(insertSql)
                .parameter("App", identity.appName())
                .parameter("Machine", identity.machineName())
                .parameter("Username", identity.userName())
                .parameter("Timestamp", Timestamp.from(entry.timestamp()))
                .parameter("Level", entry.level().displayName())
                .parameter("Category", null)
                .parameter("Message", entry.formattedBody())
                .build();
    }

    /** Builder for {@link JdbcDestination}. */
    public static final class Builder {
        private final String identifier;
        private Severity minimumLevel = Severity.WARN;
        private ConnectionProvider connectionProvider;
        private String tableName = TableNames.DEFAULT_TABLE;

        private Builder(String identifier) {
            this.identifier = identifier;
        }

        public Builder minimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
            return this;
        }

        /**
         * Connects through {@link java.sql.DriverManager} using a descriptor such as
         * {@code "Url=jdbc:postgresql://db/app;Database=app;User=log;Password=secret"}.
         *
         * @param descriptor the connection descriptor
         * @return this builder
         * @throws ConfigurationException if the descriptor is invalid
         * @see ConnectionDescriptor
         */
        public Builder connectionDescriptor(String descriptor) {
            this.connectionProvider = new DescriptorConnectionProvider(ConnectionDescriptor.parse(descriptor));
            return this;
        }

        public Builder dataSource(DataSource dataSource) {
            this.connectionProvider = new DataSourceConnectionProvider(dataSource);
            return this;
        }

        /**
         * Sets the connection source directly. One of this, {@link #dataSource(DataSource)} or
         * {@link #connectionDescriptor(String)} is <b>required</b>; the last call wins.
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the table name.
         *
         * <p>Optional. Defaults to {@value TableNames#DEFAULT_TABLE}.
         *
         * @param tableName a plain SQL identifier
         * @return this builder
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * @return a new destination
         * @throws ConfigurationException if no connection source is set, or the identifier or
         *     table name is invalid
         */
        public JdbcDestination build() {
            return new JdbcDestination(this);
        }
    }
}
