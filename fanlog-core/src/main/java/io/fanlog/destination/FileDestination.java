package io.fanlog.destination;

import io.fanlog.ConfigurationException;
import io.fanlog.LogEntry;
import io.fanlog.Severity;
import io.fanlog.util.Arguments;
import io.fanlog.util.Attempts;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Appends full lines to a text file, with optional rotation by line count or byte size.
 *
 * <p>The file lives in the configured directory (default: the working directory), which is
 * created at construction. Without a configured name the file is named after the current
 * date, {@code yyyy-MM-dd.log}, re-evaluated on every write.
 *
 * <h2>Rotation</h2>
 * <p>Before each write, when {@link #maxLines()} or {@link #maxBytes()} is positive, the
 * current file is archived if it already holds {@code maxLines} lines or more, or, failing
 * that, if it is larger than {@code maxBytes}. The archive is named
 * {@code <base>_<seq>.<ext>}, where {@code seq} is the number of files in the directory that
 * start with {@code <base>} and end with {@code .<ext>}, padded to three digits. A failed
 * rotation leaves the file in place and the write proceeds.
 *
 * <pre>{@code
 * FileDestination file = FileDestination.builder("File")
 *     .directory(Path.of("logs"))
 *     .maxLines(10_000)
 *     .build();
 * }</pre>
 */
public final class FileDestination extends AbstractDestination {
    public static final String DEFAULT_EXTENSION = ".log";
    private static final DateTimeFormatter DATE_FILE_NAME = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Path directory;
    private final String fileName;
    private final Clock clock;
    private volatile int maxLines;
    private volatile long maxBytes;

    private FileDestination(Builder builder) {
        super(builder.identifier, builder.minimumLevel);
        if (builder.directory != null && builder.directory.toString().isEmpty()) {
            throw new ConfigurationException("directory cannot be empty");
        }
        if (builder.fileName != null && builder.fileName.isBlank()) {
            throw new ConfigurationException("fileName cannot be blank");
        }
        this.directory = (builder.directory != null ? builder.directory : Path.of(""))
                .toAbsolutePath().normalize();
        this.fileName = builder.fileName == null || builder.fileName.contains(".")
                ? builder.fileName : builder.fileName + DEFAULT_EXTENSION;
        this.clock = Arguments.requireNonNull(builder.clock, "clock");
        this.maxLines = (int) Arguments.requireNonNegative(builder.maxLines, "maxLines");
        this.maxBytes = Arguments.requireNonNegative(builder.maxBytes, "maxBytes");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create log directory " + directory, e);
        }
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return the file the next write goes to
     */
    public Path currentFile() {
        String name = fileName != null ? fileName : DATE_FILE_NAME.format(LocalDate.now(clock)) + DEFAULT_EXTENSION;
        return directory.resolve(name);
    }

    public int maxLines() {
        return maxLines;
    }

    /**
     * @param maxLines archive the file once it holds this many lines; 0 disables
     */
    public void setMaxLines(int maxLines) {
        this.maxLines = (int) Arguments.requireNonNegative(maxLines, "maxLines");
    }

    public long maxBytes() {
        return maxBytes;
    }

    /**
     * @param maxBytes archive the file once it is larger than this; 0 disables
     */
    public void setMaxBytes(long maxBytes) {
        this.maxBytes = Arguments.requireNonNegative(maxBytes, "maxBytes");
    }

    @Override
    protected void append(LogEntry entry) throws IOException {
        Path file = currentFile();
        if (maxLines > 0 || maxBytes > 0) {
            Attempts.attempt("rotate " + file, () -> rotateIfNeeded(file));
        }
        Files.writeString(file, entry.fullLine() + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private void rotateIfNeeded(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return;
        }
        int lineLimit = maxLines;
        if (lineLimit > 0 && countLines(file) > lineLimit - 1) {
            archive(file);
            return;
        }
        long byteLimit = maxBytes;
        if (byteLimit > 0 && Files.size(file) > byteLimit) {
            archive(file);
        }
    }

    private static long countLines(Path file) throws IOException {
        // ISO-8859-1 decodes any byte, so a corrupt file still counts.
        long lines = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            while (reader.readLine() != null) {
                lines++;
            }
        }
        return lines;
    }

    Path archive(Path file) throws IOException {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";

        int sequence = 0;
        try (DirectoryStream<Path> siblings = Files.newDirectoryStream(directory)) {
            for (Path sibling : siblings) {
                String siblingName = sibling.getFileName().toString();
                if (siblingName.startsWith(base) && siblingName.endsWith(extension)) {
                    sequence++;
                }
            }
        }

        Path target = directory.resolve(String.format("%s_%03d%s", base, sequence, extension));
        Files.deleteIfExists(target);
        return Files.move(file, target);
    }

    @Override
    public String toString() {
        return identifier() + ": " + currentFile();
    }

    /** Builder for {@link FileDestination}. */
    public static final class Builder {
        private final String identifier;
        private Severity minimumLevel = Severity.INFO;
        private Path directory;
        private String fileName;
        private int maxLines;
        private long maxBytes;
        private Clock clock = Clock.systemDefaultZone();

        private Builder(String identifier) {
            this.identifier = identifier;
        }

        public Builder minimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
            return this;
        }

        /**
         * Sets the directory holding the log file.
         *
         * <p>Optional. Defaults to the working directory. Created if absent.
         *
         * @param directory the log directory
         * @return this builder
         */
        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        /**
         * Sets a fixed file name. A name without an extension gets {@code .log}.
         *
         * <p>Optional. Defaults to the current date.
         *
         * @param fileName the file name
         * @return this builder
         */
        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder maxLines(int maxLines) {
            this.maxLines = maxLines;
            return this;
        }

        public Builder maxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
            return this;
        }

        /**
         * Sets the clock used to name date-based files. Optional.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @return a new destination
         * @throws ConfigurationException if the identifier is empty, the directory or name is
         *     empty, a limit is negative, or the directory cannot be created
         */
        public FileDestination build() {
            return new FileDestination(this);
        }
    }
}
