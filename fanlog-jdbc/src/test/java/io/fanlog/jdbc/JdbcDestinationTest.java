package io.fanlog.jdbc;

import io.fanlog.ConfigurationException;
import io.fanlog.LogEntry;
import io.fanlog.LogRegistry;
import io.fanlog.ProcessIdentity;
import io.fanlog.Severity;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcDestinationTest {
    private static final Instant AT = Instant.parse("2024-05-01T10:15:30.250Z");
    private static final ProcessIdentity IDENTITY = new ProcessIdentity("billing", "host-1", "alice");

    private String url;
    private JdbcDataSource dataSource;
    private Connection keepAlive;

    @BeforeEach
    void setUp() throws SQLException {
        url = "jdbc:h2:mem:fanlog_" + UUID.randomUUID().toString().replace("-", "");
        dataSource = new JdbcDataSource();
        dataSource.setURL(url);
        keepAlive = dataSource.getConnection();
        try (Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE LogEntries ("
                    + "Id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "App VARCHAR(255), Machine VARCHAR(255), Username VARCHAR(255), "
                    + "Timestamp TIMESTAMP, Level VARCHAR(32), Category VARCHAR(255), "
                    + "Message CLOB)");
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        keepAlive.close();
    }

    @Test
    void insertsOneRowPerEntry() {
        JdbcDestination db = JdbcDestination.builder("DB").dataSource(dataSource).build();

        db.write(entry(Severity.ERROR, "payment failed"));

        List<Row> rows = rows("LogEntries");
        assertEquals(1, rows.size());
        Row row = rows.get(0);
        assertEquals("billing", row.app);
        assertEquals("host-1", row.machine);
        assertEquals("alice", row.user);
        assertEquals(AT, row.timestamp);
        assertEquals("Error", row.level);
        assertNull(row.category);
        assertEquals("payment failed", row.message);
        assertEquals(0, db.discardedWrites());
    }

    @Test
    void defaultsToWarn() {
        JdbcDestination db = JdbcDestination.builder("DB").dataSource(dataSource).build();

        assertEquals(Severity.WARN, db.minimumLevel());
        assertEquals("LogEntries", db.tableName());
    }

    @Test
    void connectsThroughDescriptor() {
        JdbcDestination db = JdbcDestination.builder("DB")
                .connectionDescriptor("Url=\"" + url + "\";Database=FANLOG")
                .build();

        db.write(entry(Severity.CRITICAL, "via descriptor"));

        assertEquals("via descriptor", rows("LogEntries").get(0).message);
    }

    @Test
    void customTableName() throws SQLException {
        try (Statement st = keepAlive.createStatement()) {
            st.execute("CREATE TABLE audit_log AS SELECT * FROM LogEntries WHERE 1 = 0");
        }
        JdbcDestination db = JdbcDestination.builder("DB")
                .dataSource(dataSource)
                .tableName("audit_log")
                .build();

        db.write(entry(Severity.WARN, "audited"));

        assertEquals(1, rows("audit_log").size());
        assertTrue(rows("LogEntries").isEmpty());
    }

    @Test
    void missingTableIsDiscarded() {
        JdbcDestination db = JdbcDestination.builder("DB")
                .dataSource(dataSource)
                .tableName("no_such_table")
                .build();

        db.write(entry(Severity.ERROR, "lost"));

        assertEquals(1, db.discardedWrites());
    }

    @Test
    void unreachableDatabaseIsDiscarded() {
        JdbcDestination db = JdbcDestination.builder("DB")
                .connectionProvider(() -> {
                    throw new SQLException("connection refused");
                })
                .build();

        db.write(entry(Severity.ERROR, "lost"));

        assertEquals(1, db.discardedWrites());
    }

    @Test
    void registryDispatchWritesFilteredRows() {
        try (LogRegistry log = LogRegistry.builder()
                .clock(Clock.fixed(AT, ZoneOffset.UTC))
                .identity(IDENTITY)
                .destination(JdbcDestination.builder("DB").dataSource(dataSource).build())
                .build()) {
            log.info("skipped");
            log.warn("disk at 90%");
            log.error(new IllegalStateException("save failed"));
        }

        List<Row> rows = rows("LogEntries");
        assertEquals(2, rows.size());
        assertEquals("Warn", rows.get(0).level);
        assertEquals("disk at 90%", rows.get(0).message);
        assertEquals("save failed" + System.lineSeparator(), rows.get(1).message);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> JdbcDestination.builder("DB").build());
        assertThrows(ConfigurationException.class, () -> JdbcDestination.builder("DB")
                .dataSource(dataSource).tableName("bad-name").build());
        assertThrows(ConfigurationException.class, () -> JdbcDestination.builder("DB")
                .connectionDescriptor("Url=" + url));
    }

    private static LogEntry entry(Severity level, String body) {
        return new LogEntry(AT, level, body, body, "line", IDENTITY);
    }

    private List<Row> rows(String table) {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.query(conn,
                    "SELECT App, Machine, Username, Timestamp, Level, Category, Message FROM " + table + " ORDER BY Id",
                    rs -> new Row(rs.getString(1), rs.getString(2), rs.getString(3),
                            rs.getTimestamp(4).toInstant(), rs.getString(5), rs.getString(6), rs.getString(7)));
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    private record Row(String app, String machine, String user, Instant timestamp,
                       String level, String category, String message) {
    }
}
