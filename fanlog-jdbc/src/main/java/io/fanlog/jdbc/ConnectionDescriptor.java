package io.fanlog.jdbc;

import io.fanlog.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed form of a connection descriptor: semicolon-separated {@code key=value} pairs.
 *
 * <p>Recognized keys, case-insensitive:
 * <ul>
 *   <li>{@code Url}: JDBC URL. Required.</li>
 *   <li>{@code Database}: catalog selected after connecting. Required.</li>
 *   <li>{@code User} and {@code Password}: credentials, given together or not at all.</li>
 *   <li>{@code IntegratedSecurity}: {@code true} to connect without credentials.</li>
 *   <li>{@code ConnectTimeout}: seconds to wait for a connection, 0 for the driver default.
 *       Defaults to {@value #DEFAULT_CONNECT_TIMEOUT_SECONDS}.</li>
 * </ul>
 * Values may be wrapped in double or single quotes so they can contain {@code ;}; a quote
 * character is escaped by doubling it. Without credentials the descriptor uses integrated
 * security.
 *
 * <pre>{@code
 * ConnectionDescriptor d = ConnectionDescriptor.parse(
 *     "Url=\"jdbc:h2:mem:logs;DB_CLOSE_DELAY=-1\";Database=LOGS;User=sa;Password=secret");
 * }</pre>
 *
 * @param url                JDBC URL
 * @param database           catalog name
 * @param user               user name, null with integrated security
 * @param password           password, null with integrated security
 * @param integratedSecurity    whether to connect without credentials
 * @param connectTimeoutSeconds seconds to wait for a connection, 0 for the driver default
 */
public record ConnectionDescriptor(String url,
                                   String database,
                                   String user,
                                   String password,
                                   boolean integratedSecurity,
                                   int connectTimeoutSeconds) {

    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 2;

    private static final String URL = "url";
    private static final String DATABASE = "database";
    private static final String USER = "user";
    private static final String PASSWORD = "password";
    private static final String INTEGRATED_SECURITY = "integratedsecurity";
    private static final String CONNECT_TIMEOUT = "connecttimeout";

    /**
     * Parses and validates a descriptor.
     *
     * @param descriptor the descriptor text
     * @return the parsed descriptor
     * @throws ConfigurationException if the text is malformed, a key is unknown or repeated,
     *     {@code Url} or {@code Database} is missing, or only one of user and password is set
     */
    public static ConnectionDescriptor parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new ConfigurationException("connection descriptor must not be empty");
        }
        Map<String, String> values = split(descriptor);

        String url = values.get(URL);
        if (url == null || url.isEmpty()) {
            throw new ConfigurationException("The connection descriptor must specify a Url");
        }
        String database = values.get(DATABASE);
        if (database == null || database.isEmpty()) {
            throw new ConfigurationException("The connection descriptor must specify a Database");
        }

        String user = emptyToNull(values.get(USER));
        String password = emptyToNull(values.get(PASSWORD));
        boolean integrated = parseBoolean(values.get(INTEGRATED_SECURITY));
        if (integrated) {
            if (user != null || password != null) {
                throw new ConfigurationException("IntegratedSecurity cannot be combined with User or Password");
            }
        } else if ((user == null) != (password == null)) {
            throw new ConfigurationException(user == null
                    ? "Password is specified but not User"
                    : "User is specified but not Password");
        } else if (user == null) {
            integrated = true;
        }
        int connectTimeout = parseTimeout(values.get(CONNECT_TIMEOUT));
        return new ConnectionDescriptor(url, database, user, password, integrated, connectTimeout);
    }

    private static Map<String, String> split(String descriptor) {
        Map<String, String> values = new LinkedHashMap<>();
        int length = descriptor.length();
        int i = 0;
        while (i < length) {
            int eq = descriptor.indexOf('=', i);
            int semi = descriptor.indexOf(';', i);
            if (semi == i || descriptor.substring(i, semi < 0 ? length : semi).isBlank()) {
                i = semi < 0 ? length : semi + 1;
                continue;
            }
            if (eq < 0 || (semi >= 0 && semi < eq)) {
                throw new ConfigurationException("Malformed connection descriptor segment at index " + i);
            }
            String key = descriptor.substring(i, eq).trim().toLowerCase(Locale.ROOT);
            if (!isKnownKey(key)) {
                throw new ConfigurationException("Unknown connection descriptor key: "
                        + descriptor.substring(i, eq).trim());
            }

            StringBuilder value = new StringBuilder();
            int j = eq + 1;
            while (j < length && descriptor.charAt(j) == ' ') {
                j++;
            }
            if (j < length && (descriptor.charAt(j) == '"' || descriptor.charAt(j) == '\'')) {
                char quote = descriptor.charAt(j++);
                boolean closed = false;
                while (j < length) {
                    char c = descriptor.charAt(j++);
                    if (c == quote) {
                        if (j < length && descriptor.charAt(j) == quote) {
                            value.append(quote);
                            j++;
                        } else {
                            closed = true;
                            break;
                        }
                    } else {
                        value.append(c);
                    }
                }
                if (!closed) {
                    throw new ConfigurationException("Unterminated quoted value for key: " + key);
                }
                while (j < length && descriptor.charAt(j) != ';') {
                    if (!Character.isWhitespace(descriptor.charAt(j))) {
                        throw new ConfigurationException("Unexpected text after quoted value for key: " + key);
                    }
                    j++;
                }
            } else {
                int end = descriptor.indexOf(';', j);
                end = end < 0 ? length : end;
                value.append(descriptor, j, end);
                j = end;
                trimEnd(value);
            }

            if (values.put(key, value.toString()) != null) {
                throw new ConfigurationException("Duplicate connection descriptor key: " + key);
            }
            i = j + 1;
        }
        return values;
    }

    private static boolean isKnownKey(String key) {
        return URL.equals(key) || DATABASE.equals(key) || USER.equals(key)
                || PASSWORD.equals(key) || INTEGRATED_SECURITY.equals(key) || CONNECT_TIMEOUT.equals(key);
    }

    private static int parseTimeout(String value) {
        if (value == null || value.isEmpty()) {
            return DEFAULT_CONNECT_TIMEOUT_SECONDS;
        }
        int seconds;
        try {
            seconds = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("ConnectTimeout must be a whole number of seconds: " + value);
        }
        if (seconds < 0) {
            throw new ConfigurationException("ConnectTimeout must not be negative: " + value);
        }
        return seconds;
    }

    private static boolean parseBoolean(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException("IntegratedSecurity must be true or false: " + value);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static void trimEnd(StringBuilder value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        value.setLength(end);
    }

    @Override
    public String toString() {
        return "ConnectionDescriptor[url=" + url + ", database=" + database + ", user=" + user
                + ", password=" + (password != null ? "****" : null)
                + ", integratedSecurity=" + integratedSecurity
                + ", connectTimeoutSeconds=" + connectTimeoutSeconds + "]";
    }
}
