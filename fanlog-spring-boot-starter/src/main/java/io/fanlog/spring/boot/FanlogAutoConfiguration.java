package io.fanlog.spring.boot;

import io.fanlog.LogRegistry;
import io.fanlog.destination.ConsoleDestination;
import io.fanlog.destination.Destination;
import io.fanlog.destination.FileDestination;
import io.fanlog.destination.TraceDestination;
import io.fanlog.jdbc.JdbcDestination;
import io.fanlog.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;

/**
 * Auto-configuration for fanlog.
 *
 * <p>Wires a {@link LogRegistry} from {@link FanlogProperties}. Built-in destinations are
 * switched on per {@code fanlog.<destination>.enabled}; every {@link Destination} bean in the
 * context is added as well, after the built-in ones and in bean order. The JDBC destination
 * uses the application's {@link DataSource}.
 *
 * @see FanlogProperties
 * @see FanlogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(LogRegistry.class)
@EnableConfigurationProperties(FanlogProperties.class)
public class FanlogAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public LogRegistry logRegistry(FanlogProperties props,
                                   ObjectProvider<MetricsExporter> metricsProvider,
                                   ObjectProvider<DataSource> dataSourceProvider,
                                   ObjectProvider<Destination> destinationProvider) {
        LogRegistry.Builder builder = LogRegistry.builder()
                .timeFormat(props.getTimeFormat())
                .concurrentDispatch(props.isConcurrentDispatch())
                .dispatchTimeoutMs(props.getDispatchTimeoutMs());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        if (props.getHistory().isEnabled()) {
            builder.history(props.getHistory().getCapacity());
        }

        var file = props.getFile();
        if (file.isEnabled()) {
            FileDestination.Builder fileBuilder = FileDestination.builder(file.getIdentifier())
                    .minimumLevel(file.getMinimumLevel())
                    .fileName(file.getFileName())
                    .maxLines(file.getMaxLines())
                    .maxBytes(file.getMaxBytes());
            if (file.getDirectory() != null && !file.getDirectory().isEmpty()) {
                fileBuilder.directory(Path.of(file.getDirectory()));
            }
            builder.destination(fileBuilder.build());
        }

        var console = props.getConsole();
        if (console.isEnabled()) {
            builder.destination(new ConsoleDestination(console.getIdentifier(), console.getMinimumLevel()));
        }

        var trace = props.getTrace();
        if (trace.isEnabled()) {
            builder.destination(new TraceDestination(
                    trace.getIdentifier(), trace.getMinimumLevel(), trace.getLoggerName()));
        }

        var jdbc = props.getJdbc();
        if (jdbc.isEnabled()) {
            DataSource dataSource = dataSourceProvider.getIfAvailable();
            if (dataSource == null) {
                throw new IllegalStateException("fanlog.jdbc.enabled requires a DataSource bean");
            }
            builder.destination(JdbcDestination.builder(jdbc.getIdentifier())
                    .minimumLevel(jdbc.getMinimumLevel())
                    .tableName(jdbc.getTableName())
                    .dataSource(dataSource)
                    .build());
        }

        List<Destination> userDestinations = destinationProvider.orderedStream().toList();
        userDestinations.forEach(builder::destination);

        LogRegistry registry = builder.build();
        registry.setGlobalEnabled(props.isEnabled());
        return registry;
    }
}
