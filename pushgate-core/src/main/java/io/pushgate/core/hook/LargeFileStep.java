/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.preset.ScanPolicy;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Blocks working-tree files above a size limit. {@code .git} and excluded build output are not looked at. */
public final class LargeFileStep implements HookStep {
    private static final long MB = 1024L * 1024L;

    private final Path root;
    private final long maxMegabytes;
    private final ScanPolicy policy;
    private final boolean enabled;

    public LargeFileStep(Path root, long maxMegabytes, ScanPolicy policy, boolean enabled) {
        if (maxMegabytes <= 0) throw new IllegalArgumentException("maxMegabytes must be positive");
        this.root = Objects.requireNonNull(root, "root");
        this.maxMegabytes = maxMegabytes;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "large-file";
    }

    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public ExitStatus run(PrintStream out) throws IOException {
        out.printf("Checking for large files (> %dMB)...%n", maxMegabytes);
        List<Path> large = findLarge();
        if (large.isEmpty()) return ExitStatus.CLEAN;
        out.printf("Large files detected (> %dMB):%n", maxMegabytes);
        for (Path p : large) out.println("   " + root.relativize(p));
        return ExitStatus.VIOLATIONS;
    }

    List<Path> findLarge() throws IOException {
        long limit = maxMegabytes * MB;
        List<Path> large = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) return FileVisitResult.CONTINUE;
                String rel = root.relativize(dir).toString().replace('\\', '/') + "/";
                if (rel.equals(".git/") || isBuildOutput(rel)) return FileVisitResult.SKIP_SUBTREE;
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && attrs.size() > limit) large.add(file);
                return FileVisitResult.CONTINUE;
            }
        });
        large.sort(null);
        return large;
    }

    private boolean isBuildOutput(String relDir) {
        return policy.isExcluded(relDir) && !relDir.startsWith(".github/");
    }
}
