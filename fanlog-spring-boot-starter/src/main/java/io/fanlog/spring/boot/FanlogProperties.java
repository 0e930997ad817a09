package io.fanlog.spring.boot;

import io.fanlog.LogRegistry;
import io.fanlog.Severity;
import io.fanlog.destination.TraceDestination;
import io.fanlog.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for fanlog.
 *
 * @see FanlogAutoConfiguration
 */
@ConfigurationProperties(prefix = "fanlog")
public class FanlogProperties {

    /**
     * Global logging switch. When false, log calls return immediately.
     */
    private boolean enabled = true;

    /**
     * DateTimeFormatter pattern of the line timestamp.
     */
    private String timeFormat = LogRegistry.DEFAULT_TIME_FORMAT;

    /**
     * Fan out to destinations in parallel rather than on the calling thread.
     */
    private boolean concurrentDispatch = true;

    /**
     * Upper bound on a concurrent fan-out, in milliseconds. 0 waits for every write.
     */
    private long dispatchTimeoutMs;

    private final History history = new History();
    private final File file = new File();
    private final Console console = new Console();
    private final Trace trace = new Trace();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimeFormat() {
        return timeFormat;
    }

    public void setTimeFormat(String timeFormat) {
        this.timeFormat = timeFormat;
    }

    public boolean isConcurrentDispatch() {
        return concurrentDispatch;
    }

    public void setConcurrentDispatch(boolean concurrentDispatch) {
        this.concurrentDispatch = concurrentDispatch;
    }

    public long getDispatchTimeoutMs() {
        return dispatchTimeoutMs;
    }

    public void setDispatchTimeoutMs(long dispatchTimeoutMs) {
        this.dispatchTimeoutMs = dispatchTimeoutMs;
    }

    public History getHistory() {
        return history;
    }

    public File getFile() {
        return file;
    }

    public Console getConsole() {
        return console;
    }

    public Trace getTrace() {
        return trace;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class History {
        private boolean enabled;
        private int capacity = LogRegistry.DEFAULT_HISTORY_CAPACITY;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class File {
        private boolean enabled;
        private String identifier = "File";

        /**
         * Directory of the log file; the working directory when unset.
         */
        private String directory;

        /**
         * Fixed file name; a date-based name ({@code yyyy-MM-dd.log}) when unset.
         */
        private String fileName;
        private Severity minimumLevel = Severity.INFO;
        private int maxLines;
        private long maxBytes;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public Severity getMinimumLevel() {
            return minimumLevel;
        }

        public void setMinimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
        }

        public int getMaxLines() {
            return maxLines;
        }

        public void setMaxLines(int maxLines) {
            this.maxLines = maxLines;
        }

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    public static class Console {
        private boolean enabled;
        private String identifier = "Console";
        private Severity minimumLevel = Severity.DEBUG;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }

        public Severity getMinimumLevel() {
            return minimumLevel;
        }

        public void setMinimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
        }
    }

    public static class Trace {
        private boolean enabled = true;
        private String identifier = "Trace";
        private String loggerName = TraceDestination.DEFAULT_LOGGER_NAME;
        private Severity minimumLevel = Severity.DEBUG;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }

        public String getLoggerName() {
            return loggerName;
        }

        public void setLoggerName(String loggerName) {
            this.loggerName = loggerName;
        }

        public Severity getMinimumLevel() {
            return minimumLevel;
        }

        public void setMinimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
        }
    }

    public static class Jdbc {
        private boolean enabled;
        private String identifier = "DB";
        private String tableName = TableNames.DEFAULT_TABLE;
        private Severity minimumLevel = Severity.WARN;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public Severity getMinimumLevel() {
            return minimumLevel;
        }

        public void setMinimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "fanlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
