/**
 * Tabular store destination over JDBC.
 *
 * <p>{@link io.fanlog.jdbc.JdbcDestination} writes one row per entry into
 * {@value io.fanlog.jdbc.TableNames#DEFAULT_TABLE}. Connections come from a
 * {@link javax.sql.DataSource}, a {@link io.fanlog.jdbc.ConnectionDescriptor} or any
 * {@link io.fanlog.spi.ConnectionProvider}. {@link io.fanlog.jdbc.SqlCommand} doubles as a
 * loggable payload that renders its text and parameters.
 */
package io.fanlog.jdbc;
