package io.fanlog.demo;

import io.fanlog.LogRegistry;
import io.fanlog.Severity;
import io.fanlog.destination.EventLogDestination;
import io.fanlog.destination.FileDestination;
import io.fanlog.destination.NotificationDestination;
import io.fanlog.destination.TraceDestination;
import io.fanlog.format.TimePatternBuilder;
import io.fanlog.jdbc.JdbcDestination;
import io.fanlog.jdbc.SqlCommand;
import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.stream.Stream;

/**
 * Demo of the registry without Spring: trace, rotating file, H2 table, event log and
 * notification destinations, history and runtime reconfiguration.
 * <p>
 * Run with: mvn -pl samples/fanlog-demo exec:java
 */
public final class FanlogDemo {

    public static void main(String[] args) throws Exception {
        // 1. Setup H2 in-memory database and a scratch log directory
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:fanlog_demo;DB_CLOSE_DELAY=-1");
        createSchema(dataSource);
        Path logDir = Files.createTempDirectory("fanlog-demo");

        // 2. Build the registry
        try (LogRegistry log = LogRegistry.builder()
                .destination(new TraceDestination("Trace", Severity.INFO))
                .destination(FileDestination.builder("File")
                        .directory(logDir)
                        .fileName("demo.log")
                        .maxLines(5)
                        .build())
                .destination(JdbcDestination.builder("DB").dataSource(dataSource).build())
                .destination(new EventLogDestination("EventViewer", (source, message, category) ->
                        System.out.println("[EventLog] " + category + " from " + source + ": " + message.strip())))
                .destination(NotificationDestination.builder("Email")
                        .sender("demo@example.com")
                        .recipient("oncall@example.com")
                        .transport(message -> System.out.println("[Mail] " + message.subject()))
                        .build())
                .history(100)
                .build()) {

            System.out.println("=== fanlog Demo ===\n");

            // 3. Log at every level
            log.debug("debug goes nowhere: every destination is at Info or above");
            log.info("application started");
            log.warn("cache is 90% full");
            log.error(new IllegalStateException("order 42 failed", new RuntimeException("payment declined")));
            log.critical("database unreachable");

            // 4. Structured payloads
            log.warn(SqlCommand.text("UPDATE orders SET status = ? WHERE id = ?")
                    .parameter("status", "CANCELLED")
                    .parameter("id", 42)
                    .build());

            // 5. Runtime reconfiguration
            log.disable("Trace");
            log.info("not traced");
            log.enable("Trace");
            log.setMinimumLevel("DB", Severity.INFO);
            log.info("now stored in the database too");

            log.setTimeFormat(new TimePatternBuilder()
                    .day("/").month("/").year(" ")
                    .hour(":").minute(":").second(".").millisecond(6));
            log.info("custom timestamp layout");

            // 6. Force a few rotations
            for (int i = 1; i <= 12; i++) {
                log.info("filler line " + i);
            }

            System.out.println("\n=== History (last 5) ===");
            var history = log.getHistorySnapshot();
            history.subList(Math.max(0, history.size() - 5), history.size()).forEach(System.out::println);

            System.out.println("\n=== Log files in " + logDir + " ===");
            try (Stream<Path> files = Files.list(logDir)) {
                files.sorted().forEach(p -> System.out.println(p.getFileName()));
            }

            System.out.println("\n=== Database State ===");
            showLogEntries(dataSource);
        }

        System.out.println("\nDemo complete.");
    }

    private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
        String ddl;
        try (InputStream is = FanlogDemo.class.getResourceAsStream("/schema/h2.sql")) {
            if (is == null) throw new IllegalStateException("Schema resource /schema/h2.sql not found");
            ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            for (String sql : ddl.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        }
    }

    private static void showLogEntries(JdbcDataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT Timestamp, Level, Message FROM LogEntries ORDER BY Id")) {
            System.out.printf("%-23s | %-8s | %s%n", "TIMESTAMP", "LEVEL", "MESSAGE");
            System.out.println("-".repeat(80));
            while (rs.next()) {
                System.out.printf("%-23s | %-8s | %s%n",
                        rs.getTimestamp("Timestamp"),
                        rs.getString("Level"),
                        rs.getString("Message").strip().replace(System.lineSeparator(), " / "));
            }
        }
    }
}
