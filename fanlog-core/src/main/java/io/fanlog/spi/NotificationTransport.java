package io.fanlog.spi;

import io.fanlog.destination.NotificationMessage;

import java.io.IOException;

/**
 * Delivers a notification through an external channel such as SMTP.
 *
 * @see io.fanlog.destination.NotificationDestination
 */
@FunctionalInterface
public interface NotificationTransport {

    /**
     * Sends one message.
     *
     * @param message sender, recipients, subject and body
     * @throws IOException if delivery fails
     */
    void send(NotificationMessage message) throws IOException;
}
