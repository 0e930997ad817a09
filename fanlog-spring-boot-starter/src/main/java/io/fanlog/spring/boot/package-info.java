/**
 * Spring Boot auto-configuration for fanlog.
 *
 * <p>{@link io.fanlog.spring.boot.FanlogAutoConfiguration} wires a
 * {@link io.fanlog.LogRegistry} from {@code fanlog.*} application properties, with optional
 * file, console, trace and JDBC destinations plus any
 * {@link io.fanlog.destination.Destination} beans.
 * {@link io.fanlog.spring.boot.FanlogMicrometerAutoConfiguration} contributes a Micrometer
 * exporter when a {@code MeterRegistry} is present.
 *
 * @see io.fanlog.spring.boot.FanlogAutoConfiguration
 * @see io.fanlog.spring.boot.FanlogProperties
 */
package io.fanlog.spring.boot;
