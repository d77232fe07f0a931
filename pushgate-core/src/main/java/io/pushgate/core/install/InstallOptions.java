/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

/**
 * @param force replace a pre-push hook that pushgate did not generate
 * @param hooksPath install as {@code <hooksPathDir>/pre-push.d/50-security-pre-push} behind a dispatcher
 *     and point {@code core.hooksPath} at it, so other hooks can be chained
 * @param stateDir repository-relative directory for config and allowlist
 * @param hooksPathDir repository-relative hooks directory used in hooks-path mode
 */
public record InstallOptions(boolean force, boolean hooksPath, String stateDir, String hooksPathDir) {
    public static final String DEFAULT_STATE_DIR = ".security-controls";
    public static final String DEFAULT_HOOKS_PATH_DIR = ".githooks";

    public InstallOptions {
        stateDir = (stateDir == null || stateDir.isBlank()) ? DEFAULT_STATE_DIR : stateDir;
        hooksPathDir = (hooksPathDir == null || hooksPathDir.isBlank()) ? DEFAULT_HOOKS_PATH_DIR : hooksPathDir;
    }

    public static InstallOptions defaults() {
        return new InstallOptions(false, false, DEFAULT_STATE_DIR, DEFAULT_HOOKS_PATH_DIR);
    }

    public InstallOptions withForce(boolean force) {
        return new InstallOptions(force, hooksPath, stateDir, hooksPathDir);
    }

    public InstallOptions withHooksPath(boolean hooksPath) {
        return new InstallOptions(force, hooksPath, stateDir, hooksPathDir);
    }
}
