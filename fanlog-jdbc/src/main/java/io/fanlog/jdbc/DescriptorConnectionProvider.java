package io.fanlog.jdbc;

import io.fanlog.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link ConnectionProvider} that opens a new {@link DriverManager} connection per call and
 * selects the descriptor's database as catalog.
 *
 * <p>A non-zero connect timeout is passed to the driver as the {@code loginTimeout}
 * connection property, in seconds. Drivers that do not know the property ignore it.
 */
public final class DescriptorConnectionProvider implements ConnectionProvider {
    static final String LOGIN_TIMEOUT_PROPERTY = "loginTimeout";

    private final ConnectionDescriptor descriptor;

    public DescriptorConnectionProvider(ConnectionDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    public ConnectionDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Connection getConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(descriptor.url(), connectionProperties());
        try {
            conn.setCatalog(descriptor.database());
            return conn;
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    Properties connectionProperties() {
        Properties properties = new Properties();
        if (!descriptor.integratedSecurity()) {
            properties.setProperty("user", descriptor.user());
            properties.setProperty("password", descriptor.password());
        }
        if (descriptor.connectTimeoutSeconds() > 0) {
            properties.setProperty(LOGIN_TIMEOUT_PROPERTY, Integer.toString(descriptor.connectTimeoutSeconds()));
        }
        return properties;
    }
}
