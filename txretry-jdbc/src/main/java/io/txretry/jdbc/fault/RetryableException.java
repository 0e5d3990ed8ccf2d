package io.txretry.jdbc.fault;

/**
 * Marker interface for faults after which retrying the whole transaction is safe.
 *
 * <p>Only faults implementing this interface are retried without further configuration.
 * {@link DeadlockException} and {@link LockWaitTimeoutException} implement it out of the box.
 * Application exceptions opt in by implementing it directly:
 *
 * <pre>{@code
 * public class OptimisticLockException extends RuntimeException implements RetryableException {
 * }
 * }</pre>
 *
 * <p>For third-party exceptions that cannot implement this interface, configure an
 * extension rule through {@code TransactionOptions.withRetryableExceptions(..)} instead.
 */
public interface RetryableException {
}
