package io.fanlog.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single "attempt, then discard" policy applied at every destination boundary.
 *
 * <p>A failed action is reported through the returned {@link Outcome} and logged at
 * {@link Level#FINE} only, which the default JUL configuration does not print. Errors
 * ({@link Error} subclasses) are not caught.
 */
public final class Attempts {
    private static final Logger logger = Logger.getLogger(Attempts.class.getName());

    private Attempts() {
    }

    /**
     * Result of an attempted action.
     */
    public enum Outcome {
        WRITTEN,
        DISCARDED
    }

    /**
     * An action that may fail with any checked or unchecked exception.
     */
    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    /**
     * Runs {@code action}, absorbing any exception it throws.
     *
     * @param description what is being attempted, used in the FINE log record
     * @param action      the action to run
     * @return {@link Outcome#WRITTEN} if the action completed, otherwise {@link Outcome#DISCARDED}
     */
    public static Outcome attempt(String description, Action action) {
        try {
            action.run();
            return Outcome.WRITTEN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logDiscarded(description, e);
            return Outcome.DISCARDED;
        } catch (Exception e) {
            logDiscarded(description, e);
            return Outcome.DISCARDED;
        }
    }

    /**
     * An action that reports its own outcome, for callees that already absorb failures.
     */
    @FunctionalInterface
    public interface ReportingAction {
        Outcome run() throws Exception;
    }

    /**
     * Runs {@code action} and returns the outcome it reports. An exception thrown by the
     * action is absorbed the same way as in {@link #attempt(String, Action)}.
     *
     * @param description what is being attempted, used in the FINE log record
     * @param action      the action to run
     * @return the reported outcome, or {@link Outcome#DISCARDED} if the action threw
     */
    public static Outcome attemptReported(String description, ReportingAction action) {
        try {
            Outcome outcome = action.run();
            return outcome != null ? outcome : Outcome.WRITTEN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logDiscarded(description, e);
            return Outcome.DISCARDED;
        } catch (Exception e) {
            logDiscarded(description, e);
            return Outcome.DISCARDED;
        }
    }

    private static void logDiscarded(String description, Exception e) {
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Discarded failure: " + description, e);
        }
    }
}
