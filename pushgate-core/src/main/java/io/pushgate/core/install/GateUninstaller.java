/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import io.pushgate.core.txn.Transaction;
import io.pushgate.core.txn.TransactionManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes what {@link GateInstaller} put in place, in one transaction. Hooks that pushgate did not
 * generate and the hooks-path dispatcher (other chained hooks may rely on it) are left alone.
 */
public final class GateUninstaller {
    private static final Logger log = LoggerFactory.getLogger(GateUninstaller.class);

    private final TransactionManager transactions;

    public GateUninstaller(TransactionManager transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
    }

    public InstallResult uninstall(Path repoRoot, InstallOptions options) {
        HookLayout.requireRepository(repoRoot);
        HookLayout layout = new HookLayout(repoRoot, options);

        List<Path> removed = new ArrayList<>();
        List<Path> kept = new ArrayList<>();
        transactions.execute("uninstall", tx -> {
            removeHook(tx, layout.legacyHook(), removed, kept);
            removeHook(tx, layout.chainedHook(), removed, kept);
            if (Files.exists(layout.dispatcher())) kept.add(layout.dispatcher());
            if (tx.atomicRemove(layout.stateDir())) removed.add(layout.stateDir());
            return null;
        });
        log.info("Removed {} path(s), kept {}", removed.size(), kept.size());
        return new InstallResult(removed, kept);
    }

    private static void removeHook(Transaction tx, Path hook, List<Path> removed, List<Path> kept) throws IOException {
        if (!Files.exists(hook)) return;
        if (!HookLayout.isGenerated(hook)) {
            log.warn("Skipping {} (not generated by pushgate)", hook);
            kept.add(hook);
            return;
        }
        tx.atomicRemove(hook);
        removed.add(hook);
    }
}
