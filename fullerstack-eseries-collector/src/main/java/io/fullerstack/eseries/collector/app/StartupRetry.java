package io.fullerstack.eseries.collector.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries a startup step with exponential backoff.
 * <p>
 * The default of 3 attempts starting at 100 ms waits 100 ms, then 200 ms, before giving up.
 */
public class StartupRetry {
    private static final Logger logger = LoggerFactory.getLogger(StartupRetry.class);

    public static final int MAX_RETRIES = 3;
    public static final Duration INITIAL_BACKOFF = Duration.ofMillis(100);

    private final int maxAttempts;
    private final Duration initialBackoff;

    public StartupRetry() {
        this(MAX_RETRIES, INITIAL_BACKOFF);
    }

    public StartupRetry(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff cannot be null");
    }

    /**
     * Run an action that returns nothing.
     */
    public void run(String what, Runnable action) {
        call(what, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Run an action until it succeeds or the attempts are used up.
     *
     * @throws StartupException with the last failure as cause
     */
    public <T> T call(String what, Supplier<T> action) {
        return callWithRetry(what, action, 1);
    }

    private <T> T callWithRetry(String what, Supplier<T> action, int attempt) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            if (attempt >= maxAttempts) {
                logger.error("{} failed after {} attempts", what, maxAttempts, e);
                throw new StartupException(what + " failed after " + maxAttempts + " attempts", e);
            }

            long backoffMs = backoff(attempt).toMillis();
            logger.warn("{} attempt {} failed, retrying in {}ms: {}", what, attempt, backoffMs, e.getMessage());

            try {
                Thread.sleep(backoffMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new StartupException("Interrupted during retry backoff", ie);
            }

            return callWithRetry(what, action, attempt + 1);
        }
    }

    /**
     * Wait before the attempt after {@code attempt}: initial × 2^(attempt-1).
     */
    Duration backoff(int attempt) {
        return initialBackoff.multipliedBy(1L << (attempt - 1));
    }

    /**
     * A startup step kept failing.
     */
    public static class StartupException extends RuntimeException {
        public StartupException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
