/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.txn;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens transactions and makes sure an open one is rolled back even when the JVM is asked to stop:
 * while a transaction is open a shutdown hook is registered that replays its rollback log.
 */
public final class TransactionManager {
    private static final Logger log = LoggerFactory.getLogger(TransactionManager.class);

    @FunctionalInterface
    public interface Work<T> {
        T apply(Transaction tx) throws IOException;
    }

    private final Clock clock;
    private final boolean guardShutdown;
    private Transaction current;
    private Thread shutdownHook;

    public TransactionManager() {
        this(Clock.systemUTC(), true);
    }

    public TransactionManager(Clock clock, boolean guardShutdown) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.guardShutdown = guardShutdown;
    }

    /**
     * Starts a new transaction with an empty rollback log. A still-open previous one is rolled back first.
     * The manager's monitor is never held while a transaction's monitor is taken, since a finishing
     * transaction calls back into the manager.
     */
    public Transaction begin(String name) {
        Transaction previous;
        synchronized (this) {
            previous = current;
        }
        if (previous != null && previous.isOpen()) {
            log.warn("Transaction '{}' was left open; rolling it back before '{}'", previous.name(), name);
            previous.rollback();
        }
        Transaction tx = new Transaction(name, clock, this::finished);
        synchronized (this) {
            current = tx;
            if (guardShutdown) registerShutdownHook(tx);
        }
        return tx;
    }

    public Optional<Transaction> current() {
        Transaction tx;
        synchronized (this) {
            tx = current;
        }
        return Optional.ofNullable(tx).filter(Transaction::isOpen);
    }

    /**
     * Runs {@code work} inside a transaction and commits it. Any failure rolls everything back before a
     * {@link TransactionFailedException} carrying the rollback report is thrown.
     */
    public <T> T execute(String name, Work<T> work) {
        Transaction tx = begin(name);
        try {
            T result = work.apply(tx);
            tx.commit();
            return result;
        } catch (IOException | RuntimeException e) {
            RollbackReport report = tx.rollback();
            throw new TransactionFailedException(
                    statusOf(e), "Transaction '" + name + "' failed and was rolled back: " + messageOf(e), e, report);
        } finally {
            tx.close();
        }
    }

    static ExitStatus statusOf(Throwable e) {
        if (e instanceof PushgateException pe) return pe.status();
        if (e instanceof AccessDeniedException) return ExitStatus.PERMISSION_ERROR;
        return ExitStatus.IO_ERROR;
    }

    private static String messageOf(Throwable e) {
        return (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
    }

    private void registerShutdownHook(Transaction tx) {
        Thread hook = new Thread(() -> {
            if (tx.isOpen()) {
                log.warn("Interrupted with transaction '{}' open", tx.name());
                tx.rollback();
            }
        }, "pushgate-rollback");
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            shutdownHook = hook;
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down; transaction '{}' runs without a shutdown guard", tx.name());
        }
    }

    private synchronized void finished() {
        Thread hook = shutdownHook;
        shutdownHook = null;
        if (hook == null || Thread.currentThread() == hook) return;
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down; shutdown guard stays registered");
        }
    }
}
