package io.fanlog.format;

import io.fanlog.Severity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DefaultMessageFormatterTest {
    private static final String NL = System.lineSeparator();

    private final DefaultMessageFormatter formatter = new DefaultMessageFormatter();

    @Test
    void nullRendersEmpty() {
        assertEquals("", formatter.formatBody(null));
    }

    @Test
    void plainValueUsesStringValue() {
        assertEquals("started", formatter.formatBody("started"));
        assertEquals("42", formatter.formatBody(42));
    }

    @Test
    void throwableRendersCauseChainMessages() {
        Exception inner = new IllegalStateException("disk full");
        Exception outer = new RuntimeException("save failed", inner);

        assertEquals("save failed" + NL + "disk full" + NL, formatter.formatBody(outer));
    }

    @Test
    void deepCauseChainRendersOutermostFirst() {
        Exception c = new Exception("c");
        Exception b = new Exception("b", c);
        Exception a = new Exception("a", b);

        assertEquals("a" + NL + "b" + NL + "c" + NL, formatter.formatBody(a));
    }

    @Test
    void throwableWithoutMessageRendersClassName() {
        assertEquals(IllegalStateException.class.getName() + NL,
                formatter.formatBody(new IllegalStateException()));
    }

    @Test
    void cyclicCauseChainTerminates() {
        CyclicException first = new CyclicException("first");
        CyclicException second = new CyclicException("second");
        first.cause = second;
        second.cause = first;

        assertEquals("first" + NL + "second" + NL, formatter.formatBody(first));
    }

    @Test
    void commandRendersKindTextAndParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("@id", 7);
        parameters.put("@name", "bob");
        StructuredCommand command = new StructuredCommand() {
            @Override
            public String kind() {
                return "Text";
            }

            @Override
            public String text() {
                return "UPDATE users SET name = @name WHERE id = @id";
            }

            @Override
            public Map<String, Object> parameters() {
                return parameters;
            }
        };

        assertEquals("Command type: Text" + NL
                        + "Command text: UPDATE users SET name = @name WHERE id = @id" + NL
                        + "Parameter: @id, Value: 7" + NL
                        + "Parameter: @name, Value: bob" + NL,
                formatter.formatBody(command));
    }

    @Test
    void formatLineJoinsTimestampCodeAndBody() {
        DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                .withZone(ZoneOffset.UTC);
        Instant at = Instant.parse("2024-01-02T03:04:05.006Z");

        assertEquals("2024-01-02 03:04:05.006 [WRN] low disk",
                formatter.formatLine(at, Severity.WARN, "low disk", timeFormat));
    }

    private static final class CyclicException extends Exception {
        private Throwable cause;

        CyclicException(String message) {
            super(message);
        }

        @Override
        public synchronized Throwable getCause() {
            return cause;
        }
    }
}
