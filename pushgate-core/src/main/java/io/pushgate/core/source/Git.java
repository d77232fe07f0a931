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
import java.util.ArrayList;
import java.util.List;

/** Thin helper for invoking the {@code git} CLI through a {@link CommandRunner}. */
final class Git {
    private Git() {}

    static CommandRunner.Result run(CommandRunner runner, Path repoRoot, Duration timeout, String... args)
            throws IOException {
        List<String> cmd = new ArrayList<>(args.length + 1);
        cmd.add("git");
        cmd.addAll(List.of(args));
        try {
            return runner.run(repoRoot, cmd, timeout);
        } catch (IOException e) {
            if (e.getMessage() != null && e.getMessage().contains("Cannot run program")) {
                throw new PushgateException(ExitStatus.TOOL_MISSING, "git is not installed or not on PATH", e);
            }
            throw e;
        }
    }
}
