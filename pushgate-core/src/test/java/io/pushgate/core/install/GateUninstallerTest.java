/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.source.CommandRunner;
import io.pushgate.core.txn.TransactionManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GateUninstallerTest {

    @TempDir
    Path repo;

    private final TransactionManager transactions = new TransactionManager(Clock.systemUTC(), false);
    private final CommandRunner git = (dir, cmd, timeout) ->
            new CommandRunner.Result(cmd.contains("--get") ? 1 : 0, "", "", false);

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(repo.resolve(".git/hooks"));
    }

    @Test
    void removesWhatInstallPutInPlace() throws IOException {
        new GateInstaller(transactions, git).install(repo, InstallOptions.defaults());

        InstallResult result = new GateUninstaller(transactions).uninstall(repo, InstallOptions.defaults());

        assertFalse(Files.exists(repo.resolve(".git/hooks/pre-push")));
        assertFalse(Files.exists(repo.resolve(".security-controls")));
        assertEquals(2, result.changed().size());
        try (Stream<Path> left = Files.list(repo.resolve(".git/hooks"))) {
            assertEquals(0, left.count());
        }
    }

    @Test
    void foreignHookAndDispatcherAreKept() throws IOException {
        new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true));
        Path foreign = Files.writeString(repo.resolve(".git/hooks/pre-push"), "#!/bin/sh\nmy-own-check\n");

        InstallResult result = new GateUninstaller(transactions).uninstall(repo, InstallOptions.defaults());

        assertEquals("#!/bin/sh\nmy-own-check\n", Files.readString(foreign));
        assertTrue(Files.exists(repo.resolve(".githooks/pre-push")));
        assertFalse(Files.exists(repo.resolve(".githooks/pre-push.d/50-security-pre-push")));
        assertTrue(result.kept().contains(foreign.toAbsolutePath().normalize()));
    }

    @Test
    void nothingInstalledIsANoOp() {
        InstallResult result = new GateUninstaller(transactions).uninstall(repo, InstallOptions.defaults());

        assertTrue(result.changed().isEmpty());
        assertTrue(result.kept().isEmpty());
    }

    @Test
    void requiresARepository(@TempDir Path plain) {
        PushgateException e = assertThrows(PushgateException.class,
                () -> new GateUninstaller(transactions).uninstall(plain, InstallOptions.defaults()));
        assertEquals(ExitStatus.VALIDATION_ERROR, e.status());
    }
}
