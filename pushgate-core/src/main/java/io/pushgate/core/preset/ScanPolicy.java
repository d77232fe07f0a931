/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.preset;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Source-selection and value-threshold settings of a scan.
 *
 * @param excludedPaths repository-relative path prefixes never scanned (build output, vendored code)
 * @param lockFiles file-name globs of lock files, which only fixed-signature patterns inspect
 * @param minSecretLength shortest value the generic assignment pattern reports
 * @param minEntropy lowest Shannon entropy (bits/char) the generic assignment pattern reports
 */
public record ScanPolicy(List<String> excludedPaths, List<String> lockFiles, int minSecretLength, double minEntropy) {

    public static final int DEFAULT_MIN_SECRET_LENGTH = 8;
    public static final double DEFAULT_MIN_ENTROPY = 3.0;
    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of(
            "target/", "node_modules/", "dist/", "build/", "vendor/", "coverage/", ".git/", ".github/workflows/");
    public static final List<String> DEFAULT_LOCK_FILES = List.of(
            "*.lock", "package-lock.json", "npm-shrinkwrap.json", "pnpm-lock.yaml", "go.sum");

    public ScanPolicy {
        excludedPaths = List.copyOf(excludedPaths == null ? List.of() : excludedPaths);
        lockFiles = List.copyOf(lockFiles == null ? List.of() : lockFiles);
        if (minSecretLength < 1) throw new IllegalArgumentException("minSecretLength must be >= 1");
        if (minEntropy < 0) throw new IllegalArgumentException("minEntropy must be >= 0");
    }

    public static ScanPolicy defaults() {
        return new ScanPolicy(DEFAULT_EXCLUDED_PATHS, DEFAULT_LOCK_FILES, DEFAULT_MIN_SECRET_LENGTH, DEFAULT_MIN_ENTROPY);
    }

    public boolean isExcluded(String path) {
        String p = normalize(path);
        for (String prefix : excludedPaths) {
            if (p.startsWith(prefix)) return true;
        }
        return false;
    }

    public boolean isLockFile(String path) {
        String p = normalize(path);
        Path name = Path.of(p.substring(p.lastIndexOf('/') + 1));
        for (PathMatcher matcher : lockFileMatchers()) {
            if (matcher.matches(name)) return true;
        }
        return false;
    }

    private List<PathMatcher> lockFileMatchers() {
        List<PathMatcher> out = new ArrayList<>(lockFiles.size());
        for (String glob : lockFiles) out.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        return out;
    }

    private static String normalize(String path) {
        String p = path.replace('\\', '/');
        return p.startsWith("./") ? p.substring(2) : p;
    }
}
