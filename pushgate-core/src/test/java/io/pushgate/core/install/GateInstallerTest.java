/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.source.CommandRunner;
import io.pushgate.core.txn.TransactionFailedException;
import io.pushgate.core.txn.TransactionManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GateInstallerTest {

    @TempDir
    Path repo;

    private final TransactionManager transactions = new TransactionManager(Clock.systemUTC(), false);
    private final List<List<String>> gitCalls = new ArrayList<>();
    private final CommandRunner noGit = (dir, cmd, timeout) -> {
        throw new AssertionError("unexpected command " + cmd);
    };

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(repo.resolve(".git/hooks"));
    }

    @Test
    void installsHookConfigAndAllowlist() throws IOException {
        InstallResult result = new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults());

        Path hook = repo.resolve(".git/hooks/pre-push");
        assertTrue(Files.readString(hook).contains(HookLayout.MARKER));
        assertTrue(Files.exists(repo.resolve(".security-controls/pushgate.yml")));
        assertTrue(Files.exists(repo.resolve(".security-controls/secret-allowlist.txt")));
        assertEquals(3, result.changed().size());
        assertTrue(result.kept().isEmpty());
    }

    @Test
    void reinstallKeepsLocalEditsAndReplacesItsOwnHook() throws IOException {
        GateInstaller installer = new GateInstaller(transactions, noGit);
        installer.install(repo, InstallOptions.defaults());
        Path config = repo.resolve(".security-controls/pushgate.yml");
        Files.writeString(config, "pushgate:\n  scanner:\n    mode: all\n");

        InstallResult again = installer.install(repo, InstallOptions.defaults());

        assertEquals("pushgate:\n  scanner:\n    mode: all\n", Files.readString(config));
        assertTrue(again.kept().contains(config.toAbsolutePath().normalize()));
        assertEquals(List.of(), backupsIn(repo));
    }

    @Test
    void foreignHookIsNotReplacedWithoutForce() throws IOException {
        Path hook = Files.writeString(repo.resolve(".git/hooks/pre-push"), "#!/bin/sh\nrun-my-linter\n");

        PushgateException e = assertThrows(PushgateException.class,
                () -> new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults()));

        assertEquals(ExitStatus.VALIDATION_ERROR, e.status());
        assertEquals("#!/bin/sh\nrun-my-linter\n", Files.readString(hook));
        assertFalse(Files.exists(repo.resolve(".security-controls")));
    }

    @Test
    void forceReplacesAForeignHook() throws IOException {
        Path hook = Files.writeString(repo.resolve(".git/hooks/pre-push"), "#!/bin/sh\nrun-my-linter\n");

        new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults().withForce(true));

        assertTrue(HookLayout.isGenerated(hook));
        assertEquals(List.of(), backupsIn(repo));
    }

    @Test
    void failureWritingTheHookRemovesEverythingWrittenBefore() throws IOException {
        Path hooks = repo.resolve(".git/hooks");
        Files.delete(hooks);
        Files.writeString(hooks, "not a directory");

        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults()));

        assertNotEquals(ExitStatus.CLEAN, e.status());
        assertTrue(e.status().isOperationalError());
        assertFalse(Files.exists(repo.resolve(".security-controls")));
        assertEquals("not a directory", Files.readString(hooks));
    }

    @Test
    void failureLeavesAPreExistingConfigExactlyAsItWas() throws IOException {
        Path state = Files.createDirectories(repo.resolve(".security-controls"));
        Path config = Files.writeString(state.resolve("pushgate.yml"), "pushgate:\n  verbose: true\n");
        Path hooks = repo.resolve(".git/hooks");
        Files.delete(hooks);
        Files.writeString(hooks, "blocker");

        assertThrows(TransactionFailedException.class,
                () -> new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults()));

        assertEquals(List.of("pushgate.yml"), names(state));
        assertEquals("pushgate:\n  verbose: true\n", Files.readString(config));
    }

    @Test
    void hooksPathModeInstallsDispatcherAndChainedHook() throws IOException {
        CommandRunner git = (dir, cmd, timeout) -> {
            gitCalls.add(cmd);
            return cmd.contains("--get")
                    ? new CommandRunner.Result(1, "", "", false)
                    : new CommandRunner.Result(0, "", "", false);
        };

        new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true));

        assertTrue(Files.exists(repo.resolve(".githooks/pre-push")));
        assertTrue(HookLayout.isGenerated(repo.resolve(".githooks/pre-push.d/50-security-pre-push")));
        assertFalse(Files.exists(repo.resolve(".git/hooks/pre-push")));
        assertEquals(List.of(
                List.of("git", "config", "--get", "core.hooksPath"),
                List.of("git", "config", "core.hooksPath", ".githooks")), gitCalls);
    }

    @Test
    void existingHooksPathIsLeftAlone() {
        CommandRunner git = (dir, cmd, timeout) -> {
            gitCalls.add(cmd);
            return new CommandRunner.Result(0, "tools/hooks\n", "", false);
        };

        new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true));

        assertEquals(List.of(List.of("git", "config", "--get", "core.hooksPath")), gitCalls);
    }

    @Test
    void failingGitConfigRollsBackTheDispatcherAndUnsetsHooksPath() {
        CommandRunner git = (dir, cmd, timeout) -> {
            gitCalls.add(cmd);
            if (cmd.contains("--get")) return new CommandRunner.Result(1, "", "", false);
            if (cmd.contains("--unset")) return new CommandRunner.Result(0, "", "", false);
            return new CommandRunner.Result(255, "", "could not lock config file", false);
        };

        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true)));

        assertEquals(ExitStatus.CONFIG_ERROR, e.status());
        assertFalse(Files.exists(repo.resolve(".githooks")));
        assertFalse(Files.exists(repo.resolve(".security-controls")));
        assertEquals(List.of("git", "config", "--unset", "core.hooksPath"), gitCalls.get(gitCalls.size() - 1));
    }

    @Test
    void failedUnsetDuringRollbackIsReported() {
        CommandRunner git = (dir, cmd, timeout) -> {
            if (cmd.contains("--get")) return new CommandRunner.Result(1, "", "", false);
            if (cmd.contains("--unset")) return new CommandRunner.Result(255, "", "permission denied", false);
            return new CommandRunner.Result(255, "", "could not lock config file", false);
        };

        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true)));

        assertEquals(ExitStatus.CONFIG_ERROR, e.status());
        assertFalse(e.rollback().clean());
        assertEquals(1, e.rollback().failures().size());
        assertTrue(e.rollback().failures().get(0).contains("core.hooksPath"));
        assertTrue(e.rollback().failures().get(0).contains("permission denied"));
        assertFalse(Files.exists(repo.resolve(".security-controls")));
    }

    @Test
    void unsetOfAKeyThatWasNeverWrittenCountsAsUndone() {
        CommandRunner git = (dir, cmd, timeout) -> {
            if (cmd.contains("--get")) return new CommandRunner.Result(1, "", "", false);
            if (cmd.contains("--unset")) return new CommandRunner.Result(5, "", "", false);
            return new CommandRunner.Result(255, "", "could not lock config file", false);
        };

        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> new GateInstaller(transactions, git).install(repo, InstallOptions.defaults().withHooksPath(true)));

        assertTrue(e.rollback().clean(), () -> e.rollback().failures().toString());
    }

    @Test
    void refusesADirectoryThatIsNotARepository(@TempDir Path plain) {
        PushgateException e = assertThrows(PushgateException.class,
                () -> new GateInstaller(transactions, noGit).install(plain, InstallOptions.defaults()));
        assertEquals(ExitStatus.VALIDATION_ERROR, e.status());
    }

    @Test
    void installedHookIsExecutable() throws IOException {
        assumeTrue(Files.getFileAttributeView(repo, PosixFileAttributeView.class) != null);

        new GateInstaller(transactions, noGit).install(repo, InstallOptions.defaults());

        assertTrue(Files.isExecutable(repo.resolve(".git/hooks/pre-push")));
    }

    private static List<String> names(Path dir) throws IOException {
        try (Stream<Path> list = Files.list(dir)) {
            return list.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static List<Path> backupsIn(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(p -> p.getFileName().toString().contains(".backup.")).collect(Collectors.toList());
        }
    }
}
