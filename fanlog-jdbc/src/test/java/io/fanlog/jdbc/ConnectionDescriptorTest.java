package io.fanlog.jdbc;

import io.fanlog.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionDescriptorTest {

    @Test
    void parsesCredentials() {
        ConnectionDescriptor d = ConnectionDescriptor.parse(
                "Url=jdbc:postgresql://db/app; Database=app; User=log; Password=secret");

        assertEquals("jdbc:postgresql://db/app", d.url());
        assertEquals("app", d.database());
        assertEquals("log", d.user());
        assertEquals("secret", d.password());
        assertFalse(d.integratedSecurity());
    }

    @Test
    void keysAreCaseInsensitive() {
        ConnectionDescriptor d = ConnectionDescriptor.parse("URL=jdbc:h2:mem:x;database=X;integratedsecurity=TRUE");

        assertEquals("jdbc:h2:mem:x", d.url());
        assertTrue(d.integratedSecurity());
    }

    @Test
    void missingCredentialsMeansIntegratedSecurity() {
        ConnectionDescriptor d = ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X");

        assertTrue(d.integratedSecurity());
        assertNull(d.user());
        assertNull(d.password());
    }

    @Test
    void quotedValueMayContainSemicolons() {
        ConnectionDescriptor d = ConnectionDescriptor.parse(
                "Url=\"jdbc:h2:mem:logs;DB_CLOSE_DELAY=-1\";Database=LOGS;Password='it''s';User=sa;");

        assertEquals("jdbc:h2:mem:logs;DB_CLOSE_DELAY=-1", d.url());
        assertEquals("it's", d.password());
        assertEquals("sa", d.user());
    }

    @Test
    void userWithoutPasswordIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;User=sa"));
        assertEquals("User is specified but not Password", e.getMessage());
    }

    @Test
    void passwordWithoutUserIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;Password=p"));
        assertEquals("Password is specified but not User", e.getMessage());
    }

    @Test
    void integratedSecurityWithCredentialsIsRejected() {
        assertThrows(ConfigurationException.class, () -> ConnectionDescriptor.parse(
                "Url=jdbc:h2:mem:x;Database=X;IntegratedSecurity=true;User=sa;Password=p"));
    }

    @Test
    void requiredKeysAreEnforced() {
        assertThrows(ConfigurationException.class, () -> ConnectionDescriptor.parse("Database=X"));
        assertThrows(ConfigurationException.class, () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x"));
        assertThrows(ConfigurationException.class, () -> ConnectionDescriptor.parse(""));
        assertThrows(ConfigurationException.class, () -> ConnectionDescriptor.parse(null));
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;Timeout=5"));
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=a;Url=b;Database=X"));
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database"));
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=\"jdbc:h2:mem:x;Database=X"));
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;IntegratedSecurity=maybe"));
    }

    @Test
    void toStringMasksPassword() {
        ConnectionDescriptor d = ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;User=sa;Password=secret");

        assertFalse(d.toString().contains("secret"));
    }

    @Test
    void connectTimeoutDefaultsToTwoSeconds() {
        ConnectionDescriptor d = ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X");

        assertEquals(ConnectionDescriptor.DEFAULT_CONNECT_TIMEOUT_SECONDS, d.connectTimeoutSeconds());
        assertEquals(2, d.connectTimeoutSeconds());
    }

    @Test
    void connectTimeoutIsParsed() {
        assertEquals(15, ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;ConnectTimeout=15")
                .connectTimeoutSeconds());
        assertEquals(0, ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;connecttimeout=0")
                .connectTimeoutSeconds());
    }

    @Test
    void rejectsInvalidConnectTimeout() {
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;ConnectTimeout=soon"));
        assertThrows(ConfigurationException.class,
                () -> ConnectionDescriptor.parse("Url=jdbc:h2:mem:x;Database=X;ConnectTimeout=-1"));
    }
}
