/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.source.CommandRunner;
import io.pushgate.core.txn.RollbackAction;
import io.pushgate.core.txn.Transaction;
import io.pushgate.core.txn.TransactionManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the pre-push gate into a repository. Every file is written inside one transaction: if any
 * step fails, everything written so far is restored or removed before the error propagates.
 *
 * <p>Existing configuration and allowlist files are kept. A pre-push hook that pushgate did not generate
 * is only replaced with {@link InstallOptions#force()}.
 */
public final class GateInstaller {
    private static final Logger log = LoggerFactory.getLogger(GateInstaller.class);
    private static final Duration GIT_TIMEOUT = Duration.ofSeconds(10);
    private static final int GIT_CONFIG_KEY_MISSING = 5;

    private final TransactionManager transactions;
    private final CommandRunner runner;

    public GateInstaller(TransactionManager transactions, CommandRunner runner) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public InstallResult install(Path repoRoot, InstallOptions options) {
        HookLayout.requireRepository(repoRoot);
        HookLayout layout = new HookLayout(repoRoot, options);
        Path hook = options.hooksPath() ? layout.chainedHook() : layout.legacyHook();
        guardForeignHook(hook, options.force());

        List<Path> changed = new ArrayList<>();
        List<Path> kept = new ArrayList<>();
        transactions.execute("install", tx -> {
            tx.createDirectories(layout.stateDir());
            writeIfAbsent(tx, layout.configFile(), HookLayout.template("pushgate.yml"), changed, kept);
            writeIfAbsent(tx, layout.allowlistFile(), HookLayout.template("secret-allowlist.txt"), changed, kept);

            if (options.hooksPath()) {
                if (writeIfAbsent(tx, layout.dispatcher(), HookLayout.template("dispatcher"), changed, kept)) {
                    tx.setExecutable(layout.dispatcher());
                }
                configureHooksPath(tx, layout, options.hooksPathDir());
            }
            tx.atomicWrite(hook, HookLayout.template("pre-push"));
            tx.setExecutable(hook);
            changed.add(hook);
            return null;
        });
        log.info("Installed pre-push hook at {}", hook);
        return new InstallResult(changed, kept);
    }

    private static void guardForeignHook(Path hook, boolean force) {
        try {
            if (Files.exists(hook) && !HookLayout.isGenerated(hook) && !force) {
                throw new PushgateException(ExitStatus.VALIDATION_ERROR,
                        "A pre-push hook not generated by pushgate exists at " + hook + "; use --force to replace it"
                                + " (a backup is kept until the install commits) or --hooks-path to chain it");
            }
        } catch (IOException e) {
            throw new PushgateException(ExitStatus.IO_ERROR, "Cannot inspect " + hook + ": " + e.getMessage(), e);
        }
    }

    private static boolean writeIfAbsent(Transaction tx, Path file, String content, List<Path> changed, List<Path> kept)
            throws IOException {
        if (Files.exists(file)) {
            kept.add(file);
            return false;
        }
        tx.atomicWrite(file, content);
        changed.add(file);
        return true;
    }

    /** Points {@code core.hooksPath} at the dispatcher unless the repository already chose a hooks path. */
    private void configureHooksPath(Transaction tx, HookLayout layout, String hooksPathDir) throws IOException {
        CommandRunner.Result current =
                runner.run(layout.root(), List.of("git", "config", "--get", "core.hooksPath"), GIT_TIMEOUT);
        String existing = current.stdout().strip();
        if (current.succeeded() && !existing.isEmpty()) {
            log.info("git core.hooksPath already set to {}", existing);
            return;
        }
        tx.addRollback(RollbackAction.of("unset core.hooksPath", () -> {
            CommandRunner.Result unset =
                    runner.run(layout.root(), List.of("git", "config", "--unset", "core.hooksPath"), GIT_TIMEOUT);
            // exit 5: the key was never written
            if (!unset.succeeded() && (unset.timedOut() || unset.exitCode() != GIT_CONFIG_KEY_MISSING)) {
                throw new IOException("git config --unset core.hooksPath failed: " + unset.stderr().strip());
            }
        }));
        CommandRunner.Result set =
                runner.run(layout.root(), List.of("git", "config", "core.hooksPath", hooksPathDir), GIT_TIMEOUT);
        if (!set.succeeded()) {
            throw new PushgateException(ExitStatus.CONFIG_ERROR, "git config core.hooksPath failed: " + set.stderr().strip());
        }
    }
}
