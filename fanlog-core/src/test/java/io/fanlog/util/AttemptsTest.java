package io.fanlog.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttemptsTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void completedActionIsWritten() {
        AtomicBoolean ran = new AtomicBoolean();

        assertEquals(Attempts.Outcome.WRITTEN, Attempts.attempt("ok", () -> ran.set(true)));
        assertTrue(ran.get());
    }

    @Test
    void checkedFailureIsDiscarded() {
        assertEquals(Attempts.Outcome.DISCARDED, Attempts.attempt("io", () -> {
            throw new IOException("unreachable");
        }));
    }

    @Test
    void uncheckedFailureIsDiscarded() {
        assertEquals(Attempts.Outcome.DISCARDED, Attempts.attempt("npe", () -> {
            throw new NullPointerException();
        }));
    }

    @Test
    void interruptionIsDiscardedAndFlagRestored() {
        assertEquals(Attempts.Outcome.DISCARDED, Attempts.attempt("sleep", () -> {
            throw new InterruptedException();
        }));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void errorsPropagate() {
        assertThrows(AssertionError.class, () -> Attempts.attempt("error", () -> {
            throw new AssertionError("fatal");
        }));
    }

    @Test
    void reportedOutcomeIsReturned() {
        assertEquals(Attempts.Outcome.WRITTEN,
                Attempts.attemptReported("ok", () -> Attempts.Outcome.WRITTEN));
        assertEquals(Attempts.Outcome.DISCARDED,
                Attempts.attemptReported("absorbed", () -> Attempts.Outcome.DISCARDED));
    }

    @Test
    void reportingActionThatThrowsIsDiscarded() {
        assertEquals(Attempts.Outcome.DISCARDED, Attempts.attemptReported("io", () -> {
            throw new IOException("disk gone");
        }));
    }
}
