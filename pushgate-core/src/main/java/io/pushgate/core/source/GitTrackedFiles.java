/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/** Lists tracked files with {@code git ls-files -z}. */
public final class GitTrackedFiles implements TrackedFileLister {
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final Path repoRoot;
    private final CommandRunner runner;

    public GitTrackedFiles(Path repoRoot, CommandRunner runner) {
        this.repoRoot = repoRoot;
        this.runner = runner;
    }

    @Override
    public List<String> trackedFiles() throws IOException {
        CommandRunner.Result r = Git.run(runner, repoRoot, TIMEOUT, "ls-files", "-z");
        if (!r.succeeded()) {
            throw new PushgateException(ExitStatus.VALIDATION_ERROR, "git ls-files failed: " + r.stderr().strip());
        }
        return Arrays.stream(r.stdout().split("\0")).filter(s -> !s.isEmpty()).toList();
    }
}
