package io.txretry.jdbc.retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import io.txretry.jdbc.util.ExceptionUtils;

/**
 * Retry listener delegating to a logger.
 */
public class LoggingRetryListener implements RetryListener {
    private final AtomicInteger totalSuccess = new AtomicInteger();

    private final AtomicInteger totalFailures = new AtomicInteger();

    protected final Logger logger;

    private final Marker marker = MarkerFactory.getMarker("RETRY");

    public LoggingRetryListener() {
        this(LoggerFactory.getLogger(LoggingRetryListener.class));
    }

    public LoggingRetryListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void beforeRetry(int attempt, int maxAttempts, Throwable fault) {
        logger.info(marker,
                "Transaction retry started: attempt [{}/{}] due to [{}]\n{}",
                attempt, maxAttempts, fault.getClass().getSimpleName(), ExceptionUtils.toNestedString(fault));
    }

    @Override
    public void afterRetry(int attempt, int maxAttempts, Throwable fault, Duration executionTime) {
        if (fault != null) {
            totalFailures.incrementAndGet();
            logger.warn(marker,
                    "Transaction retry failed: attempt [{}/{}] time [{}]. Total [{}] successful [{}] failed\n{}",
                    attempt, maxAttempts, executionTime,
                    totalSuccess.get(), totalFailures.get(),
                    ExceptionUtils.toNestedString(fault));
        } else {
            totalSuccess.incrementAndGet();
            logger.info(marker,
                    "Transaction retry successful: attempt [{}/{}] time [{}]. Total [{}] successful [{}] failed",
                    attempt, maxAttempts, executionTime,
                    totalSuccess.get(), totalFailures.get());
        }
    }

    public void resetCounters() {
        totalSuccess.set(0);
        totalFailures.set(0);
    }

    public int getTotalSuccessfulRetries() {
        return totalSuccess.get();
    }

    public int getTotalFailedRetries() {
        return totalFailures.get();
    }
}
