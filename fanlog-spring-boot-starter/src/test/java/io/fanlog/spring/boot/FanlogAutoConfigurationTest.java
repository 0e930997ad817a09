package io.fanlog.spring.boot;

import io.fanlog.Log;
import io.fanlog.LogRegistry;
import io.fanlog.Severity;
import io.fanlog.destination.FileDestination;
import io.fanlog.destination.TraceDestination;
import io.fanlog.jdbc.JdbcDestination;
import io.fanlog.jdbc.JdbcTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FanlogAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FanlogAutoConfiguration.class));

    @TempDir
    Path dir;

    @Test
    void createsRegistryWithTraceByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("logRegistry"));
            LogRegistry registry = ctx.getBean(LogRegistry.class);
            assertEquals(Set.of("Trace"), registry.identifiers());
            assertInstanceOf(TraceDestination.class, registry.find("Trace").orElseThrow());
            assertTrue(registry.isGlobalEnabled());
            assertFalse(registry.isHistoryEnabled());
            assertSame(registry, ctx.getBean(Log.class));
        });
    }

    @Test
    void appliesRegistrySettings() {
        runner.withPropertyValues(
                "fanlog.enabled=false",
                "fanlog.time-format=HH:mm:ss",
                "fanlog.concurrent-dispatch=false",
                "fanlog.dispatch-timeout-ms=500",
                "fanlog.history.enabled=true",
                "fanlog.history.capacity=5",
                "fanlog.trace.enabled=false"
        ).run(ctx -> {
            LogRegistry registry = ctx.getBean(LogRegistry.class);
            assertFalse(registry.isGlobalEnabled());
            assertEquals("HH:mm:ss", registry.timeFormat());
            assertFalse(registry.isConcurrentDispatch());
            assertEquals(500, registry.dispatchTimeoutMs());
            assertTrue(registry.isHistoryEnabled());
            assertTrue(registry.identifiers().isEmpty());
        });
    }

    @Test
    void fileDestinationFromProperties() {
        runner.withPropertyValues(
                "fanlog.trace.enabled=false",
                "fanlog.file.enabled=true",
                "fanlog.file.directory=" + dir,
                "fanlog.file.file-name=app.log",
                "fanlog.file.minimum-level=WARN",
                "fanlog.file.max-lines=100"
        ).run(ctx -> {
            LogRegistry registry = ctx.getBean(LogRegistry.class);
            FileDestination file = (FileDestination) registry.find("File").orElseThrow();
            assertEquals(Severity.WARN, file.minimumLevel());
            assertEquals(100, file.maxLines());

            registry.info("filtered");
            registry.error("written");

            List<String> lines = Files.readAllLines(dir.resolve("app.log"));
            assertEquals(1, lines.size());
            assertTrue(lines.get(0).endsWith("[ERR] written"));
        });
    }

    @Test
    void jdbcDestinationUsesApplicationDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        FanlogAutoConfiguration.class))
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:fanlog_auto_test;DB_CLOSE_DELAY=-1",
                        "spring.datasource.driver-class-name=org.h2.Driver",
                        "fanlog.trace.enabled=false",
                        "fanlog.jdbc.enabled=true")
                .run(ctx -> {
                    DataSource dataSource = ctx.getBean(DataSource.class);
                    try (Connection conn = dataSource.getConnection();
                         Statement st = conn.createStatement()) {
                        st.execute("CREATE TABLE LogEntries (App VARCHAR(255), Machine VARCHAR(255), "
                                + "Username VARCHAR(255), Timestamp TIMESTAMP, Level VARCHAR(32), "
                                + "Category VARCHAR(255), Message CLOB)");
                    }
                    LogRegistry registry = ctx.getBean(LogRegistry.class);
                    assertInstanceOf(JdbcDestination.class, registry.find("DB").orElseThrow());

                    registry.info("below warn");
                    registry.critical("stored");

                    try (Connection conn = dataSource.getConnection()) {
                        List<String> levels = JdbcTemplate.query(conn,
                                "SELECT Level FROM LogEntries", rs -> rs.getString(1));
                        assertEquals(List.of("Critical"), levels);
                    }
                });
    }

    @Test
    void jdbcWithoutDataSourceFailsStartup() {
        runner.withPropertyValues("fanlog.jdbc.enabled=true").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Test
    void invalidTimeFormatFailsStartup() {
        runner.withPropertyValues("fanlog.time-format=yyyy {").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
        });
    }

    @Test
    void addsDestinationBeans() {
        runner.withUserConfiguration(CustomDestinationConfig.class).run(ctx -> {
            LogRegistry registry = ctx.getBean(LogRegistry.class);
            assertEquals(List.of("Trace", "Audit"), List.copyOf(registry.identifiers()));
        });
    }

    @Test
    void backsOffWhenUserDefinesRegistry() {
        runner.withUserConfiguration(CustomRegistryConfig.class).run(ctx -> {
            LogRegistry registry = ctx.getBean(LogRegistry.class);
            assertTrue(registry.identifiers().isEmpty());
        });
    }

    @Configuration
    static class CustomDestinationConfig {
        @Bean
        TraceDestination auditDestination() {
            return new TraceDestination("Audit", Severity.WARN, "app.audit");
        }
    }

    @Configuration
    static class CustomRegistryConfig {
        @Bean
        LogRegistry customRegistry() {
            return new LogRegistry();
        }
    }
}
