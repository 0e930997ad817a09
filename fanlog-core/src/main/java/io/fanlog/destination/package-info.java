/**
 * The {@link io.fanlog.destination.Destination} contract and the built-in sinks: file with
 * rotation, console, JVM trace stream, platform event log and notification.
 *
 * <p>The JDBC table sink lives in {@code fanlog-jdbc}.
 */
package io.fanlog.destination;
