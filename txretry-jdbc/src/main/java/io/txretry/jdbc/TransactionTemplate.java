package io.txretry.jdbc;

import java.lang.reflect.InvocationTargetException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;

import javax.sql.DataSource;

import org.postgresql.util.PSQLState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.txretry.jdbc.fault.ConnectionException;
import io.txretry.jdbc.fault.FaultTranslator;
import io.txretry.jdbc.fault.SqlStateFaultTranslator;
import io.txretry.jdbc.retry.EmptyRetryListener;
import io.txretry.jdbc.retry.RetryListener;
import io.txretry.jdbc.util.Assert;
import io.txretry.jdbc.util.ExceptionUtils;
import io.txretry.jdbc.util.ResourceSupplier;

/**
 * Executes a callback within a JDBC transaction with automatic commit, rollback and retries
 * as decided by {@link TransactionOptions#shouldRetry(Throwable)}.
 *
 * <p>Each attempt runs on a fresh connection from the connection supplier with auto-commit
 * disabled. There is no backoff between attempts. When the fault of an attempt is not
 * retryable, the attempt budget is spent or the current thread is interrupted, the fault
 * of the last attempt is thrown as-is.
 */
public class TransactionTemplate {
    public static final String MDC_ATTEMPT = "tx.attempt";

    private static final Logger logger = LoggerFactory.getLogger(TransactionTemplate.class);

    private final ResourceSupplier<Connection> connectionSupplier;

    private RetryListener retryListener = new EmptyRetryListener();

    private FaultTranslator faultTranslator = SqlStateFaultTranslator.INSTANCE;

    public TransactionTemplate(DataSource dataSource) {
        this(toConnectionSupplier(dataSource));
    }

    public TransactionTemplate(ResourceSupplier<Connection> connectionSupplier) {
        Assert.notNull(connectionSupplier, "connectionSupplier is null");
        this.connectionSupplier = connectionSupplier;
    }

    private static ResourceSupplier<Connection> toConnectionSupplier(DataSource dataSource) {
        Assert.notNull(dataSource, "dataSource is null");
        return dataSource::getConnection;
    }

    public RetryListener getRetryListener() {
        return retryListener;
    }

    public TransactionTemplate setRetryListener(RetryListener retryListener) {
        Assert.notNull(retryListener, "retryListener is null");
        this.retryListener = retryListener;
        return this;
    }

    public FaultTranslator getFaultTranslator() {
        return faultTranslator;
    }

    public TransactionTemplate setFaultTranslator(FaultTranslator faultTranslator) {
        Assert.notNull(faultTranslator, "faultTranslator is null");
        this.faultTranslator = faultTranslator;
        return this;
    }

    /**
     * Configure the template from properties, see {@link TransactionProperty}.
     *
     * @param properties the configuration properties
     * @return this template
     * @throws InvalidConfigurationException if the retry listener cannot be created
     */
    public TransactionTemplate configure(Properties properties) {
        Assert.notNull(properties, "properties is null");
        return setRetryListener(loadRetryListener(properties));
    }

    @SuppressWarnings("unchecked")
    protected RetryListener loadRetryListener(Properties properties) {
        String className = TransactionProperty.RETRY_LISTENER_CLASSNAME.getValue(properties);
        try {
            Class<?> retryListenerClass = Class.forName(className);
            if (!RetryListener.class.isAssignableFrom(retryListenerClass)) {
                throw new InvalidConfigurationException("Class " + className
                        + " does not implement " + RetryListener.class.getName());
            }
            RetryListener retryListener = ((Class<RetryListener>) retryListenerClass)
                    .getDeclaredConstructor().newInstance();
            retryListener.configure(properties);
            return retryListener;
        } catch (ClassNotFoundException | InstantiationException | IllegalAccessException | InvocationTargetException |
                 NoSuchMethodException e) {
            throw new InvalidConfigurationException("Unable to create instance of retry listener: " + className, e);
        }
    }

    /**
     * Execute the callback in a single attempt transaction, see {@link TransactionOptions#DEFAULT}.
     */
    public <T> T execute(TransactionCallback<T> action) throws SQLException {
        return execute(action, TransactionOptions.DEFAULT);
    }

    /**
     * Execute the callback within a transaction, retrying as permitted by the options.
     *
     * @param action the unit of work
     * @param options retry and isolation options
     * @param <T> result type
     * @return the callback result of the successful attempt
     * @throws SQLException the classified fault of the last attempt
     */
    public <T> T execute(TransactionCallback<T> action, TransactionOptions options) throws SQLException {
        Assert.notNull(action, "action is null");
        Assert.notNull(options, "options is null");

        final Instant startTime = Instant.now();
        final int maxAttempts = options.getAttempts();

        try {
            for (int attempt = 1; ; attempt++) {
                Exception fault;
                try {
                    T result = executeAttempt(action, options);
                    if (attempt > 1) {
                        retryListener.afterRetry(attempt, maxAttempts, null,
                                Duration.between(startTime, Instant.now()));
                    }
                    return result;
                } catch (SQLException ex) {
                    fault = faultTranslator.translate(ex);
                } catch (RuntimeException ex) {
                    fault = ex;
                }

                if (attempt > 1) {
                    retryListener.afterRetry(attempt, maxAttempts, fault,
                            Duration.between(startTime, Instant.now()));
                }

                if (!options.shouldRetry(fault)) {
                    logger.debug("Non-retryable fault in attempt [{}/{}]: {}", attempt, maxAttempts, fault.toString());
                    throw propagate(fault);
                }
                if (attempt >= maxAttempts) {
                    logger.debug("No attempts left after attempt [{}/{}]: {}", attempt, maxAttempts, fault.toString());
                    throw propagate(fault);
                }
                if (Thread.currentThread().isInterrupted()) {
                    logger.debug("Interrupted after attempt [{}/{}]: {}", attempt, maxAttempts, fault.toString());
                    throw propagate(fault);
                }

                MDC.put(MDC_ATTEMPT, Integer.toString(attempt + 1));
                retryListener.beforeRetry(attempt + 1, maxAttempts, fault);
            }
        } finally {
            MDC.remove(MDC_ATTEMPT);
        }
    }

    protected <T> T executeAttempt(TransactionCallback<T> action, TransactionOptions options) throws SQLException {
        final Connection conn = connectionSupplier.get();
        if (conn == null) {
            throw new ConnectionException("Connection supplier returned null",
                    PSQLState.CONNECTION_DOES_NOT_EXIST);
        }

        T result;
        try {
            conn.setAutoCommit(false);
            try {
                if (options.getIsolationLevel().isPresent()) {
                    applyIsolationLevel(conn, options.getIsolationLevel().get());
                }
                result = action.doInTransaction(conn);
                conn.commit();
            } catch (SQLException ex) {
                SQLException fault = faultTranslator.translate(ex);
                rollback(conn, fault);
                throw fault;
            } catch (RuntimeException | Error ex) {
                rollback(conn, ex);
                throw ex;
            }
        } catch (SQLException | RuntimeException | Error ex) {
            close(conn, ex);
            throw ex;
        }

        // Committed, a close failure must not fail or repeat the attempt
        close(conn, null);
        return result;
    }

    protected void applyIsolationLevel(Connection conn, IsolationLevel isolationLevel) throws SQLException {
        try (Statement statement = conn.createStatement()) {
            statement.execute("SET TRANSACTION ISOLATION LEVEL " + isolationLevel.toSql());
        }
    }

    private void rollback(Connection conn, Throwable fault) {
        try {
            conn.rollback();
        } catch (SQLException ex) {
            fault.addSuppressed(ex);
            logger.warn("Rollback failed for connection [{}]\n{}",
                    connectionInfo(conn), ExceptionUtils.toNestedString(ex));
        }
    }

    private void close(Connection conn, Throwable fault) {
        try {
            conn.close();
        } catch (SQLException ex) {
            if (fault != null) {
                fault.addSuppressed(ex);
            }
            logger.warn("Close failed for connection [{}]\n{}",
                    connectionInfo(conn), ExceptionUtils.toNestedString(ex));
        }
    }

    protected String connectionInfo(Connection connection) {
        return "connection@" + Integer.toHexString(connection.hashCode());
    }

    private static SQLException propagate(Exception fault) {
        if (fault instanceof RuntimeException) {
            throw (RuntimeException) fault;
        }
        return (SQLException) fault;
    }
}
