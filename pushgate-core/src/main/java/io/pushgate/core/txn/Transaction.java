/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.txn;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered rollback log plus the filesystem mutations that feed it.
 *
 * <p>Every mutation first snapshots what it is about to change, then registers the inverse action, and
 * only then touches the target. Closing a transaction that was never committed rolls it back, so
 * try-with-resources guarantees the log is replayed on every non-success exit path.
 *
 * <p>Backups are written next to the original as {@code <name>.backup.<millis>} and deleted on commit.
 */
public final class Transaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    enum State {
        OPEN,
        COMMITTED,
        ROLLED_BACK
    }

    private final String name;
    private final Clock clock;
    private final Runnable onFinish;
    private final Deque<RollbackAction> rollbacks = new ArrayDeque<>();
    private final List<Path> backups = new ArrayList<>();
    private State state = State.OPEN;

    Transaction(String name, Clock clock, Runnable onFinish) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onFinish = (onFinish == null) ? () -> {} : onFinish;
        log.debug("Transaction started: {}", name);
    }

    public String name() {
        return name;
    }

    public synchronized boolean isOpen() {
        return state == State.OPEN;
    }

    /** Number of inverse actions currently in the log. */
    public synchronized int pendingRollbacks() {
        return rollbacks.size();
    }

    public synchronized void addRollback(RollbackAction action) {
        ensureOpen();
        rollbacks.push(Objects.requireNonNull(action, "action"));
        log.debug("Added rollback action: {}", action.description());
    }

    /** Clears the log without executing it and drops the backups it kept. */
    public synchronized void commit() {
        ensureOpen();
        rollbacks.clear();
        state = State.COMMITTED;
        for (Path backup : backups) {
            try {
                deleteRecursively(backup);
            } catch (IOException e) {
                log.warn("Could not delete backup {}: {}", backup, e.toString());
            }
        }
        backups.clear();
        log.debug("Transaction committed: {}", name);
        onFinish.run();
    }

    /**
     * Replays the log in reverse order. A failing action is recorded and the next one still runs, so a
     * rollback always completes. Calling this on a finished transaction is a no-op.
     */
    public synchronized RollbackReport rollback() {
        if (state != State.OPEN) return new RollbackReport(name, 0, List.of());
        log.warn("Rolling back transaction '{}' ({} action(s))", name, rollbacks.size());

        int executed = 0;
        List<String> failures = new ArrayList<>();
        while (!rollbacks.isEmpty()) {
            RollbackAction action = rollbacks.pop();
            executed++;
            try {
                action.undo();
                log.debug("Rolled back: {}", action.description());
            } catch (IOException | RuntimeException e) {
                log.error("Rollback action failed: {} ({})", action.description(), e.toString());
                failures.add(action.description() + ": " + e);
            }
        }
        state = State.ROLLED_BACK;
        backups.clear();
        onFinish.run();
        return new RollbackReport(name, executed, failures);
    }

    @Override
    public void close() {
        if (isOpen()) rollback();
    }

    public void atomicWrite(Path file, String content) throws IOException {
        atomicWrite(file, content.getBytes(StandardCharsets.UTF_8));
    }

    /** Replaces {@code file} with {@code content} through a temp file and an atomic rename. */
    public synchronized void atomicWrite(Path file, byte[] content) throws IOException {
        ensureOpen();
        Path target = file.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null && !Files.isDirectory(parent)) createDirectories(parent);

        boolean existed = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        if (existed) {
            Path backup = backupPathFor(target);
            Files.copy(target, backup, StandardCopyOption.COPY_ATTRIBUTES);
            backups.add(backup);
            addRollback(RollbackAction.of(
                    "restore " + target + " from " + backup.getFileName(),
                    () -> Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING)));
        } else {
            addRollback(RollbackAction.of("delete " + target, () -> {
                if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) Files.delete(target);
            }));
        }

        Path tmp = target.resolveSibling("." + target.getFileName() + "." + clock.millis() + ".tmp");
        try {
            Files.write(tmp, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            if (existed) copyPermissions(target, tmp);
            moveReplacing(tmp, target);
        } finally {
            if (Files.exists(tmp, LinkOption.NOFOLLOW_LINKS)) Files.delete(tmp);
        }
        log.debug("Atomic write completed: {}", target);
    }

    /** Moves {@code source} onto {@code dest}; rollback puts both back where they were. */
    public synchronized void atomicMove(Path source, Path dest) throws IOException {
        ensureOpen();
        Path src = source.toAbsolutePath();
        Path target = dest.toAbsolutePath();
        Path backup = null;
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            backup = backupPathFor(target);
            Files.copy(target, backup, StandardCopyOption.COPY_ATTRIBUTES);
            backups.add(backup);
        }
        try {
            moveReplacing(src, target);
        } catch (IOException e) {
            if (backup != null) {
                backups.remove(backup);
                Files.delete(backup);
            }
            throw e;
        }
        // only a completed move has anything to undo
        Path saved = backup;
        addRollback(RollbackAction.of("move " + target + " back to " + src, () -> {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                Files.move(target, src, StandardCopyOption.REPLACE_EXISTING);
            }
            if (saved != null) Files.move(saved, target, StandardCopyOption.REPLACE_EXISTING);
        }));
        log.debug("Atomic move: {} -> {}", src, target);
    }

    /**
     * Removes a file or directory tree by renaming it to a backup; rollback renames it back.
     *
     * @return false when there was nothing to remove
     */
    public synchronized boolean atomicRemove(Path path) throws IOException {
        ensureOpen();
        Path target = path.toAbsolutePath();
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            log.debug("Nothing to remove at {}", target);
            return false;
        }
        Path backup = backupPathFor(target);
        addRollback(RollbackAction.of("restore " + target + " from " + backup.getFileName(), () -> {
            if (!Files.exists(backup, LinkOption.NOFOLLOW_LINKS)) return;
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) deleteRecursively(target);
            Files.move(backup, target);
        }));
        Files.move(target, backup);
        backups.add(backup);
        log.debug("Atomic remove: {} (backup {})", target, backup.getFileName());
        return true;
    }

    /** Creates {@code dir} and any missing parents; rollback deletes exactly the ones created here. */
    public synchronized void createDirectories(Path dir) throws IOException {
        ensureOpen();
        Path target = dir.toAbsolutePath();
        List<Path> missing = new ArrayList<>();
        for (Path p = target; p != null && !Files.exists(p); p = p.getParent()) missing.add(p);
        if (missing.isEmpty()) return;

        addRollback(RollbackAction.of("delete directories " + missing, () -> {
            for (Path p : missing) Files.deleteIfExists(p);
        }));
        Files.createDirectories(target);
    }

    /** Adds execute permission wherever read permission is set (chmod +x); rollback restores the old mode. */
    public synchronized void setExecutable(Path file) throws IOException {
        ensureOpen();
        Path target = file.toAbsolutePath();
        PosixFileAttributeView posix = Files.getFileAttributeView(target, PosixFileAttributeView.class);
        if (posix == null) {
            boolean before = target.toFile().canExecute();
            addRollback(RollbackAction.of("restore mode of " + target, () -> {
                if (!target.toFile().setExecutable(before)) throw new IOException("cannot change mode of " + target);
            }));
            if (!target.toFile().setExecutable(true)) throw new IOException("cannot make executable: " + target);
            return;
        }

        Set<PosixFilePermission> before = EnumSet.copyOf(posix.readAttributes().permissions());
        addRollback(RollbackAction.of(
                "restore mode of " + target, () -> Files.setPosixFilePermissions(target, before)));
        Set<PosixFilePermission> after = EnumSet.copyOf(before);
        after.add(PosixFilePermission.OWNER_EXECUTE);
        if (before.contains(PosixFilePermission.GROUP_READ)) after.add(PosixFilePermission.GROUP_EXECUTE);
        if (before.contains(PosixFilePermission.OTHERS_READ)) after.add(PosixFilePermission.OTHERS_EXECUTE);
        Files.setPosixFilePermissions(target, after);
    }

    private void ensureOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Transaction '" + name + "' is already " + state.name().toLowerCase());
        }
    }

    private Path backupPathFor(Path target) {
        String base = target.getFileName() + ".backup." + clock.millis();
        Path candidate = target.resolveSibling(base);
        for (int i = 1; Files.exists(candidate, LinkOption.NOFOLLOW_LINKS); i++) {
            candidate = target.resolveSibling(base + "." + i);
        }
        return candidate;
    }

    private static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        if (view != null) Files.setPosixFilePermissions(to, view.readAttributes().permissions());
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) return;
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
