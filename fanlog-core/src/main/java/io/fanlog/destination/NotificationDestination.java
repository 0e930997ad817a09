package io.fanlog.destination;

import io.fanlog.ConfigurationException;
import io.fanlog.LogEntry;
import io.fanlog.ProcessIdentity;
import io.fanlog.Severity;
import io.fanlog.spi.NotificationTransport;
import io.fanlog.util.Arguments;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Sends each entry as a notification (typically e-mail) through a
 * {@link NotificationTransport}.
 *
 * <p>The subject reads {@code "[CRT] <app> on <machine>"}; the body holds the full line
 * followed by the process identity. Defaults to {@link Severity#CRITICAL}.
 *
 * <pre>{@code
 * NotificationDestination mail = NotificationDestination.builder("Mail")
 *     .sender("app@example.com")
 *     .recipient("oncall@example.com")
 *     .transport(smtpTransport)
 *     .build();
 * }</pre>
 */
public final class NotificationDestination extends AbstractDestination {
    private static final String NEW_LINE = System.lineSeparator();

    private final String sender;
    private final List<String> recipients;
    private final NotificationTransport transport;

    private NotificationDestination(Builder builder) {
        super(builder.identifier, builder.minimumLevel);
        this.sender = Arguments.requireNonEmpty(builder.sender, "sender");
        if (builder.recipients.isEmpty()) {
            throw new ConfigurationException("At least one recipient is required: " + builder.identifier);
        }
        for (String recipient : builder.recipients) {
            Arguments.requireNonEmpty(recipient, "recipient");
        }
        this.recipients = List.copyOf(builder.recipients);
        this.transport = Arguments.requireNonNull(builder.transport, "transport");
    }

    public static Builder builder(String identifier) {
        return new Builder(identifier);
    }

    public String sender() {
        return sender;
    }

    public List<String> recipients() {
        return recipients;
    }

    @Override
    protected void append(LogEntry entry) throws IOException {
        transport.send(toMessage(entry));
    }

    NotificationMessage toMessage(LogEntry entry) {
        ProcessIdentity identity = entry.identity();
        String subject = "[" + entry.level().shortCode() + "] " + identity.appName()
                + " on " + identity.machineName();
        String body = entry.fullLine() + NEW_LINE + NEW_LINE
                + "Application: " + identity.appName() + NEW_LINE
                + "Machine: " + identity.machineName() + NEW_LINE
                + "User: " + identity.userName() + NEW_LINE;
        return new NotificationMessage(sender, recipients, subject, body);
    }

    /** Builder for {@link NotificationDestination}. */
    public static final class Builder {
        private final String identifier;
        private Severity minimumLevel = Severity.CRITICAL;
        private String sender;
        private final List<String> recipients = new ArrayList<>();
        private NotificationTransport transport;

        private Builder(String identifier) {
            this.identifier = identifier;
        }

        public Builder minimumLevel(Severity minimumLevel) {
            this.minimumLevel = minimumLevel;
            return this;
        }

        /**
         * Sets the sender address. <b>Required.</b>
         *
         * @param sender the sender address
         * @return this builder
         */
        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipients.add(recipient);
            return this;
        }

        public Builder recipients(Collection<String> recipients) {
            this.recipients.addAll(recipients);
            return this;
        }

        /**
         * Sets the delivery channel. <b>Required.</b>
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(NotificationTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * @return a new destination
         * @throws ConfigurationException if the identifier or sender is empty, no recipient
         *     was given, or no transport was set
         */
        public NotificationDestination build() {
            return new NotificationDestination(this);
        }
    }
}
