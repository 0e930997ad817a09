package io.fanlog.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised while writing log rows.
 */
public final class LogStoreException extends RuntimeException {
    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
