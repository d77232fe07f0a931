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
import java.util.List;

/** Reads the staged change set from {@code git diff --cached} (added, copied and modified files). */
public final class GitChangeSetProvider implements ChangeSetProvider {
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final Path repoRoot;
    private final CommandRunner runner;

    public GitChangeSetProvider(Path repoRoot, CommandRunner runner) {
        this.repoRoot = repoRoot;
        this.runner = runner;
    }

    @Override
    public List<AddedLine> addedLines() throws IOException {
        CommandRunner.Result r = Git.run(runner, repoRoot, TIMEOUT,
                "diff", "--cached", "-U0", "--no-color", "--no-ext-diff",
                "--diff-filter=ACM", "--src-prefix=a/", "--dst-prefix=b/");
        if (!r.succeeded()) {
            throw new PushgateException(ExitStatus.VALIDATION_ERROR,
                    "git diff --cached failed: " + r.stderr().strip());
        }
        return UnifiedDiffParser.parse(r.stdout());
    }
}
