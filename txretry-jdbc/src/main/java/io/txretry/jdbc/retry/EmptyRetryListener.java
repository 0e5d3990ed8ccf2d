package io.txretry.jdbc.retry;

/**
 * A no-op retry listener.
 */
public class EmptyRetryListener implements RetryListener {
}
