package io.txretry.demo;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.txretry.jdbc.StandardIsolationLevel;
import io.txretry.jdbc.TransactionOptions;
import io.txretry.jdbc.TransactionProperty;
import io.txretry.jdbc.TransactionTemplate;
import io.txretry.jdbc.fault.FaultKind;
import io.txretry.jdbc.retry.LoggingRetryListener;

/**
 * Concurrent funds transfers from a single system account to many user accounts. The
 * contention on the system account produces serialization failures that are retried
 * by the transaction template.
 */
public class TransferDemo {
    private static final Logger logger = LoggerFactory.getLogger(TransferDemo.class);

    public static void main(String[] args) throws Exception {
        String url = "jdbc:postgresql://localhost:5432/txretry_demo";
        String username = "postgres";
        String password = "";
        int concurrency = Runtime.getRuntime().availableProcessors() * 2;

        // System properties first, command line overrides
        TransactionOptions options = TransactionOptions.fromProperties(System.getProperties());
        if (System.getProperty(TransactionProperty.ATTEMPTS.getName()) == null) {
            options = options.withAttempts(10);
        }
        if (options.getIsolationLevel().isEmpty()) {
            options = options.withIsolationLevel(StandardIsolationLevel.SERIALIZABLE);
        }

        LinkedList<String> argsList = new LinkedList<>(Arrays.asList(args));
        while (!argsList.isEmpty()) {
            String arg = argsList.pop();
            if (arg.startsWith("--concurrency=")) {
                concurrency = Integer.parseInt(valueOf(arg));
            } else if (arg.startsWith("--url=")) {
                url = valueOf(arg);
            } else if (arg.startsWith("--username=")) {
                username = valueOf(arg);
            } else if (arg.startsWith("--password=")) {
                password = valueOf(arg);
            } else if (arg.startsWith("--attempts=")) {
                options = options.withAttempts(Integer.parseInt(valueOf(arg)));
            } else if (arg.startsWith("--isolation=")) {
                options = options.withIsolationLevel(StandardIsolationLevel.fromSql(valueOf(arg)));
            } else {
                System.out.println("Usage: java -jar txretry-demo.jar [options]");
                System.out.println("Options include:");
                System.out.println("--concurrency=N     number of threads");
                System.out.println("--url=<jdbc-url>    JDBC connection URL");
                System.out.println("--username=<user>   JDBC user name");
                System.out.println("--password=<secret> JDBC password");
                System.out.println("--attempts=N        transaction attempts including the first (default 10)");
                System.out.println("--isolation=<level> transaction isolation level (default SERIALIZABLE)");
                System.exit(0);
            }
        }

        PGSimpleDataSource ds = new PGSimpleDataSource();
        ds.setUrl(url);
        ds.setUser(username);
        ds.setPassword(password);

        TransactionTemplate template = new TransactionTemplate(ds)
                .configure(System.getProperties());

        SchemaSupport.setupSchema(template);

        final List<Long> userAccounts = new ArrayList<>();
        final List<Long> systemAccounts = new ArrayList<>();

        template.execute(conn -> {
            AccountRepository.findAccountIds(conn, systemAccounts, userAccounts);
            return null;
        });

        if (systemAccounts.isEmpty()) {
            throw new DataAccessException("No system account found");
        }

        final ExecutorService executorService = Executors.newFixedThreadPool(concurrency);
        final Deque<Future<BigDecimal>> futures = new ArrayDeque<>();
        final BigDecimal amount = new BigDecimal("100.00");
        final TransactionOptions transferOptions = options;

        logger.info("Starting demo: {} system accounts, {} user accounts, {} concurrent workers, {}",
                systemAccounts.size(), userAccounts.size(), concurrency, transferOptions);

        userAccounts.forEach(userAccountId -> futures.add(executorService.submit(() -> {
            List<AccountLeg> legs = new ArrayList<>();
            legs.add(AccountLeg.debit(systemAccounts.get(0), amount));
            legs.add(AccountLeg.credit(userAccountId, amount));
            return template.execute(TransferService.transfer(legs), transferOptions);
        })));

        int commits = 0;
        int rollbacks = 0;

        while (!futures.isEmpty()) {
            try {
                futures.pop().get();
                commits++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                rollbacks++;
                Throwable cause = e.getCause();
                logger.warn("Transfer rolled back with fault [{}]: {}", FaultKind.of(cause), cause.toString());
            } finally {
                System.out.printf("Awaiting completion (%d commits %d rollbacks %d remaining)\n",
                        commits, rollbacks, futures.size());
            }
        }

        executorService.shutdownNow();

        System.out.printf("Summary: %s\n", commitRate(commits, rollbacks));
        if (template.getRetryListener() instanceof LoggingRetryListener) {
            LoggingRetryListener listener = (LoggingRetryListener) template.getRetryListener();
            System.out.printf("Retries: %d successful %d failed\n",
                    listener.getTotalSuccessfulRetries(), listener.getTotalFailedRetries());
        }
    }

    private static String valueOf(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    static String commitRate(int success, int failures) {
        return String.format("\u001B[33mCommits: %d Rollbacks: %d Commit Rate: %.2f%%\u001B[0m",
                success,
                failures,
                100 - (failures / (double) (Math.max(1, success + failures))) * 100.0);
    }
}
