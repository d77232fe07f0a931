/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.source.CommandRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Asks the registry for a manifest digest through {@code docker buildx imagetools inspect}. */
public final class DockerImageDigestResolver implements ImageDigestResolver {
    private static final Logger log = LoggerFactory.getLogger(DockerImageDigestResolver.class);
    private static final Pattern DIGEST = Pattern.compile("sha256:[0-9a-f]{64}");

    private final CommandRunner runner;
    private final Path workDir;
    private final Duration timeout;

    public DockerImageDigestResolver(CommandRunner runner, Path workDir, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String resolve(String image) {
        List<String> command = List.of(
                "docker", "buildx", "imagetools", "inspect", image, "--format", "{{.Manifest.Digest}}");
        CommandRunner.Result result;
        try {
            result = runner.run(workDir, command, timeout);
        } catch (IOException e) {
            throw new ResolutionException(ExitStatus.TOOL_MISSING, "docker is not available: " + e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new ResolutionException("Digest lookup for " + image + " timed out after " + timeout.toSeconds() + "s");
        }
        String digest = result.stdout().strip();
        if (!result.succeeded() || !DIGEST.matcher(digest).matches()) {
            throw new ResolutionException("Could not resolve digest for " + image + ": "
                    + (result.succeeded() ? "unexpected output '" + digest + "'" : result.stderr().strip()));
        }
        log.debug("Resolved {} to {}", image, digest);
        return digest;
    }
}
