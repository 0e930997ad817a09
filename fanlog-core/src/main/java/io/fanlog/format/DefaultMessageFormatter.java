package io.fanlog.format;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Formatter for the payload shapes the registry knows about.
 *
 * <ul>
 *   <li>{@code null} renders as the empty string.</li>
 *   <li>A {@link Throwable} renders one line per link of its cause chain, outermost first,
 *       each holding only the message text. Stack traces are not included.</li>
 *   <li>A {@link StructuredCommand} renders its kind, its text and its parameters.</li>
 *   <li>Anything else renders with {@link String#valueOf(Object)}.</li>
 * </ul>
 *
 * <p>Every rendered line of a throwable or a command ends with the platform line separator.
 * This class is stateless and thread-safe.
 */
public class DefaultMessageFormatter implements MessageFormatter {
    private static final String NEW_LINE = System.lineSeparator();

    @Override
    public String formatBody(Object payload) {
        if (payload == null) {
            return "";
        }
        if (payload instanceof Throwable throwable) {
            return formatThrowable(throwable);
        }
        if (payload instanceof StructuredCommand command) {
            return formatCommand(command);
        }
        return String.valueOf(payload);
    }

    protected String formatThrowable(Throwable throwable) {
        StringBuilder builder = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = throwable; current != null && seen.add(current); current = current.getCause()) {
            String message = current.getMessage();
            builder.append(message != null ? message : current.getClass().getName()).append(NEW_LINE);
        }
        return builder.toString();
    }

    protected String formatCommand(StructuredCommand command) {
        StringBuilder builder = new StringBuilder();
        builder.append("Command type: ").append(command.kind()).append(NEW_LINE);
        builder.append("Command text: ").append(command.text()).append(NEW_LINE);
        for (Map.Entry<String, Object> parameter : command.parameters().entrySet()) {
            builder.append("Parameter: ").append(parameter.getKey())
                    .append(", Value: ").append(parameter.getValue()).append(NEW_LINE);
        }
        return builder.toString();
    }
}
