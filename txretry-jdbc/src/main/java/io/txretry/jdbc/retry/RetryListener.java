package io.txretry.jdbc.retry;

import java.time.Duration;
import java.util.Properties;

/**
 * Interface specifying the API to be implemented by a class providing
 * a retry listener.
 *
 * <p>See {@link LoggingRetryListener}.
 */
@SuppressWarnings("EmptyMethod")
public interface RetryListener {
    /**
     * Configure the listener, if supported.
     *
     * @param properties the configuration properties
     */
    default void configure(Properties properties) {
    }

    /**
     * Invoked before a transaction retry attempt.
     *
     * @param attempt the upcoming attempt number, 1-based, so the first retry is attempt 2
     * @param maxAttempts the attempt budget
     * @param fault the retryable fault of the previous attempt
     */
    default void beforeRetry(int attempt, int maxAttempts, Throwable fault) {
    }

    /**
     * Invoked at the end of a transaction retry attempt, regardless whether it succeeded or failed.
     *
     * @param attempt the attempt number, 1-based
     * @param maxAttempts the attempt budget
     * @param fault the fault of this attempt, or null if the retry was successful
     * @param executionTime total time spent since the first attempt
     */
    default void afterRetry(int attempt, int maxAttempts, Throwable fault, Duration executionTime) {
    }
}
