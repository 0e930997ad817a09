/**
 * Root API for fanlog, a process-local logging dispatch core.
 *
 * <h2>Core Design</h2>
 * <p>A {@link io.fanlog.LogRegistry} owns a set of
 * {@linkplain io.fanlog.destination.Destination destinations}, each with its own minimum
 * {@link io.fanlog.Severity} and enabled flag. A leveled call formats its payload once into a
 * {@link io.fanlog.LogEntry}, selects the qualifying destinations and fans the entry out,
 * concurrently on a daemon pool or sequentially on the caller thread. Destination failures
 * never reach the caller; they are discarded through
 * {@link io.fanlog.util.Attempts#attempt}.
 *
 * <p>An optional bounded {@linkplain io.fanlog.history.HistoryBuffer history} keeps the most
 * recent formatted lines for inspection.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>fanlog-core</b> - registry, formatting, history, file/console/trace/event-log/
 *       notification destinations (zero external deps)</li>
 *   <li><b>fanlog-jdbc</b> - {@linkplain io.fanlog.jdbc tabular store destination} over JDBC</li>
 *   <li><b>fanlog-micrometer</b> - optional {@linkplain io.fanlog.micrometer Micrometer metrics
 *       bridge}</li>
 *   <li><b>fanlog-spring-boot-starter</b> - Spring Boot
 *       {@linkplain io.fanlog.spring.boot auto-configuration}</li>
 * </ul>
 *
 * @see io.fanlog.LogRegistry
 * @see io.fanlog.destination.FileDestination
 */
package io.fanlog;
