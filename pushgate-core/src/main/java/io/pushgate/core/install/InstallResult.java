/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import java.nio.file.Path;
import java.util.List;

/** What an install or uninstall touched. {@code kept} are files left alone on purpose. */
public record InstallResult(List<Path> changed, List<Path> kept) {

    public InstallResult {
        changed = List.copyOf(changed);
        kept = List.copyOf(kept);
    }
}
