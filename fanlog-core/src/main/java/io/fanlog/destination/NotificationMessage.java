package io.fanlog.destination;

import java.util.List;
import java.util.Objects;

/**
 * A notification built from one log entry.
 *
 * @param sender     sender address
 * @param recipients recipient addresses, at least one
 * @param subject    subject line
 * @param body       message body
 */
public record NotificationMessage(String sender, List<String> recipients, String subject, String body) {

    public NotificationMessage {
        Objects.requireNonNull(sender, "sender");
        recipients = List.copyOf(recipients);
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(body, "body");
    }
}
