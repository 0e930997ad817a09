/**
 * Service provider interfaces for external collaborators: platform event log, notification
 * transport, JDBC connections and metrics export.
 */
package io.fanlog.spi;
