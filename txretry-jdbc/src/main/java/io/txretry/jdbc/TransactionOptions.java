package io.txretry.jdbc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Predicate;

import io.txretry.jdbc.fault.FaultKind;
import io.txretry.jdbc.fault.RetryableException;
import io.txretry.jdbc.util.Assert;

/**
 * Immutable configuration object for transaction execution.
 *
 * <p>Passed to {@link TransactionTemplate#execute(TransactionCallback, TransactionOptions)} to
 * control the attempt budget, isolation level and application-level retryable exceptions.
 * All {@code with*} methods return a new instance, so options can be shared and composed freely.
 *
 * <h2>Retry decision hierarchy</h2>
 *
 * <ol>
 *     <li>Marker interface. Any fault implementing {@link RetryableException} is retried. This
 *     includes {@code DeadlockException} and {@code LockWaitTimeoutException} out of the box.</li>
 *     <li>Known permanent SQL faults. Any fault whose {@link FaultKind} is permanent (constraint
 *     violation, authentication, connection, prepared statement, query, transaction, timeout) is
 *     never retried, regardless of the extension rule.</li>
 *     <li>Extension rule. Faults outside the taxonomy are handed to the predicate or type list
 *     configured through {@link #withRetryableExceptions(Predicate)}. Without one they are not
 *     retried.</li>
 * </ol>
 *
 * <pre>{@code
 * TransactionOptions options = TransactionOptions.defaults()
 *         .withAttempts(3)
 *         .withIsolationLevel(StandardIsolationLevel.SERIALIZABLE)
 *         .withRetryableExceptions(ThirdPartyException.class);
 * }</pre>
 */
public final class TransactionOptions {
    /**
     * One attempt, server default isolation level and no extension rule.
     */
    public static final TransactionOptions DEFAULT = new TransactionOptions(1, null, null, null);

    private final int attempts;

    private final IsolationLevel isolationLevel;

    /**
     * The validated type list when the extension rule was given as types, otherwise null.
     */
    private final List<Class<? extends Throwable>> retryableTypes;

    /**
     * Normalized extension rule, or null if none is configured.
     */
    private final Predicate<Throwable> retryPredicate;

    private TransactionOptions(int attempts,
                               IsolationLevel isolationLevel,
                               List<Class<? extends Throwable>> retryableTypes,
                               Predicate<Throwable> retryPredicate) {
        this.attempts = validateAttempts(attempts);
        this.isolationLevel = isolationLevel;
        this.retryableTypes = retryableTypes;
        this.retryPredicate = retryPredicate;
    }

    public static TransactionOptions defaults() {
        return DEFAULT;
    }

    public static TransactionOptions create() {
        return new TransactionOptions(1, null, null, null);
    }

    public static TransactionOptions create(int attempts) {
        return new TransactionOptions(attempts, null, null, null);
    }

    public static TransactionOptions create(int attempts, IsolationLevel isolationLevel) {
        return new TransactionOptions(attempts, isolationLevel, null, null);
    }

    /**
     * @param attempts total number of attempts, at least 1
     * @param isolationLevel isolation level or null for the server default
     * @param retryPredicate extension rule for faults outside the taxonomy, or null for none
     * @return new options
     * @throws InvalidConfigurationException if attempts is less than 1
     */
    public static TransactionOptions create(int attempts,
                                            IsolationLevel isolationLevel,
                                            Predicate<Throwable> retryPredicate) {
        return new TransactionOptions(attempts, isolationLevel, null, retryPredicate);
    }

    /**
     * @param attempts total number of attempts, at least 1
     * @param isolationLevel isolation level or null for the server default
     * @param retryableTypes non-empty list of exception types to retry, or null for none
     * @return new options
     * @throws InvalidConfigurationException if attempts is less than 1 or the type list is
     * empty, contains null or a type not extending Throwable
     */
    public static TransactionOptions create(int attempts,
                                            IsolationLevel isolationLevel,
                                            Collection<? extends Class<?>> retryableTypes) {
        if (retryableTypes == null) {
            return new TransactionOptions(attempts, isolationLevel, null, null);
        }
        List<Class<? extends Throwable>> types = validateRetryableTypes(retryableTypes);
        return new TransactionOptions(attempts, isolationLevel, types, matchAny(types));
    }

    /**
     * Build options from configuration properties, see {@link TransactionProperty}.
     *
     * @param properties the configuration properties
     * @return new options
     * @throws InvalidConfigurationException on any invalid property value
     */
    public static TransactionOptions fromProperties(Properties properties) {
        Assert.notNull(properties, "properties is null");

        String attemptsValue = TransactionProperty.ATTEMPTS.getValue(properties);
        TransactionOptions options;
        try {
            options = create(Integer.parseInt(attemptsValue.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Property \"" + TransactionProperty.ATTEMPTS.getName()
                    + "\" must be an integer, got \"" + attemptsValue + "\"", e);
        }

        String isolationValue = TransactionProperty.ISOLATION_LEVEL.getValue(properties);
        if (isolationValue != null && !isolationValue.isBlank()) {
            options = options.withIsolationLevel(StandardIsolationLevel.fromSql(isolationValue));
        }

        String exceptionsValue = TransactionProperty.RETRYABLE_EXCEPTIONS.getValue(properties);
        if (exceptionsValue != null && !exceptionsValue.isBlank()) {
            options = options.withRetryableExceptionNames(
                    Arrays.stream(exceptionsValue.split(","))
                            .map(String::trim)
                            .toArray(String[]::new));
        }

        return options;
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<IsolationLevel> getIsolationLevel() {
        return Optional.ofNullable(isolationLevel);
    }

    public boolean hasRetryableExceptions() {
        return retryPredicate != null;
    }

    /**
     * @return the configured exception types, empty if the extension rule is a predicate or absent
     */
    public List<Class<? extends Throwable>> getRetryableExceptionTypes() {
        return retryableTypes != null ? retryableTypes : Collections.emptyList();
    }

    /**
     * Returns a new instance with the given number of attempts.
     *
     * @throws InvalidConfigurationException if attempts is less than 1
     */
    public TransactionOptions withAttempts(int attempts) {
        return new TransactionOptions(attempts, isolationLevel, retryableTypes, retryPredicate);
    }

    /**
     * Returns a new instance with the given isolation level, or the server default if null.
     */
    public TransactionOptions withIsolationLevel(IsolationLevel isolationLevel) {
        return new TransactionOptions(attempts, isolationLevel, retryableTypes, retryPredicate);
    }

    /**
     * Returns a new instance retrying faults outside the taxonomy for which the predicate
     * returns true. Use this only for third-party exceptions; exceptions you own should
     * implement {@link RetryableException} instead.
     *
     * @throws InvalidConfigurationException if the predicate is null
     */
    public TransactionOptions withRetryableExceptions(Predicate<Throwable> retryPredicate) {
        if (retryPredicate == null) {
            throw new InvalidConfigurationException(
                    "TransactionOptions: retryableExceptions is null. Use withoutRetryableExceptions() to disable.");
        }
        return new TransactionOptions(attempts, isolationLevel, null, retryPredicate);
    }

    /**
     * Returns a new instance retrying faults outside the taxonomy that are instances of any
     * of the given types.
     *
     * @throws InvalidConfigurationException if no types are given, or any is null or does not
     * extend Throwable
     */
    public TransactionOptions withRetryableExceptions(Class<?>... retryableTypes) {
        return withRetryableExceptions(retryableTypes == null ? null : Arrays.asList(retryableTypes));
    }

    public TransactionOptions withRetryableExceptions(Collection<? extends Class<?>> retryableTypes) {
        if (retryableTypes == null) {
            throw new InvalidConfigurationException(
                    "TransactionOptions: retryableExceptions is null. Use withoutRetryableExceptions() to disable.");
        }
        List<Class<? extends Throwable>> types = validateRetryableTypes(retryableTypes);
        return new TransactionOptions(attempts, isolationLevel, types, matchAny(types));
    }

    /**
     * Returns a new instance retrying faults that are instances of any of the named classes,
     * resolved through the thread context class loader.
     *
     * @throws InvalidConfigurationException if no names are given, or any name is blank,
     * cannot be resolved or does not denote a Throwable
     */
    public TransactionOptions withRetryableExceptionNames(String... classNames) {
        if (classNames == null) {
            throw new InvalidConfigurationException(
                    "TransactionOptions: retryableExceptions is null. Use withoutRetryableExceptions() to disable.");
        }
        if (classNames.length == 0) {
            throw emptyRetryableExceptions();
        }

        ClassLoader classLoader = resolveClassLoader();
        List<Class<?>> types = new ArrayList<>(classNames.length);

        for (int index = 0; index < classNames.length; index++) {
            String className = classNames[index];
            if (className == null || className.isBlank()) {
                throw new InvalidConfigurationException(String.format(
                        "TransactionOptions: retryableExceptions[%d] must be a class name, got \"%s\".",
                        index, className));
            }
            try {
                types.add(Class.forName(className, false, classLoader));
            } catch (ClassNotFoundException | LinkageError e) {
                throw new InvalidConfigurationException(String.format(
                        "TransactionOptions: retryableExceptions[%d] \"%s\" does not exist. "
                                + "Ensure the class is on the classpath.",
                        index, className), e);
            }
        }

        return withRetryableExceptions(types);
    }

    /**
     * Returns a new instance without extension rule. The {@link RetryableException} marker
     * still applies.
     */
    public TransactionOptions withoutRetryableExceptions() {
        return new TransactionOptions(attempts, isolationLevel, null, null);
    }

    /**
     * Determines whether a failed transaction attempt should be retried. Intended to be called
     * once per failed attempt by transaction execution loops. The attempt budget is not
     * considered here.
     *
     * @param fault the fault of the failed attempt
     * @return true to retry, false to propagate the fault
     */
    public boolean shouldRetry(Throwable fault) {
        Assert.notNull(fault, "fault is null");

        // Checked first, since DeadlockException and LockWaitTimeoutException
        // descend from permanent kinds
        if (FaultKind.isRetryable(fault)) {
            return true;
        }

        if (FaultKind.of(fault).isPermanent()) {
            return false;
        }

        return retryPredicate != null && retryPredicate.test(fault);
    }

    private static int validateAttempts(int attempts) {
        if (attempts < 1) {
            throw new InvalidConfigurationException(
                    "TransactionOptions: attempts must be at least 1, got " + attempts + ".");
        }
        return attempts;
    }

    @SuppressWarnings("unchecked")
    private static List<Class<? extends Throwable>> validateRetryableTypes(Collection<? extends Class<?>> types) {
        if (types.isEmpty()) {
            throw emptyRetryableExceptions();
        }

        List<Class<? extends Throwable>> validated = new ArrayList<>(types.size());
        int index = 0;

        for (Class<?> type : types) {
            if (type == null) {
                throw new InvalidConfigurationException(String.format(
                        "TransactionOptions: retryableExceptions[%d] must be a class, got null.", index));
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new InvalidConfigurationException(String.format(
                        "TransactionOptions: retryableExceptions[%d] \"%s\" must extend Throwable. "
                                + "Only exception and error classes are valid.",
                        index, type.getName()));
            }
            validated.add((Class<? extends Throwable>) type);
            index++;
        }

        return Collections.unmodifiableList(validated);
    }

    private static Predicate<Throwable> matchAny(List<Class<? extends Throwable>> types) {
        return fault -> types.stream().anyMatch(type -> type.isInstance(fault));
    }

    private static InvalidConfigurationException emptyRetryableExceptions() {
        return new InvalidConfigurationException(
                "TransactionOptions: retryableExceptions must not be empty. "
                        + "Use withoutRetryableExceptions() to disable.");
    }

    private static ClassLoader resolveClassLoader() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        return classLoader != null ? classLoader : TransactionOptions.class.getClassLoader();
    }

    @Override
    public String toString() {
        return "TransactionOptions{" +
                "attempts=" + attempts +
                ", isolationLevel=" + (isolationLevel != null ? isolationLevel.toSql() : null) +
                ", retryableExceptions=" + (retryableTypes != null ? retryableTypes
                : retryPredicate != null ? "<predicate>" : null) +
                '}';
    }
}
