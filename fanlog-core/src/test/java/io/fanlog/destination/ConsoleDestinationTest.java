package io.fanlog.destination;

import io.fanlog.ConfigurationException;
import io.fanlog.Severity;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConsoleDestinationTest {

    @Test
    void printsFullLine() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleDestination console = new ConsoleDestination("Console", Severity.DEBUG,
                new PrintStream(buffer, true, StandardCharsets.UTF_8), true);

        console.write(Entries.entry(Severity.DEBUG, "hello"));

        assertEquals("2024-05-01 10:15:30.250 [DBG] hello" + System.lineSeparator(),
                buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void nonInteractiveProcessIsRejected() {
        assertThrows(ConfigurationException.class, () -> new ConsoleDestination("Console", Severity.DEBUG,
                new PrintStream(new ByteArrayOutputStream()), false));
    }

    @Test
    void streamErrorIsDiscarded() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws java.io.IOException {
                throw new java.io.IOException("closed");
            }
        };
        ConsoleDestination console = new ConsoleDestination("Console", Severity.DEBUG,
                new PrintStream(broken), true);

        console.write(Entries.entry(Severity.INFO, "lost"));

        assertEquals(1, console.discardedWrites());
    }
}
