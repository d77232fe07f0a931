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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves action refs with {@code git ls-remote}. For an annotated tag the peeled commit
 * ({@code refs/tags/<ref>^{}}) wins over the tag object itself; tags win over branches.
 */
public final class GitLsRemoteShaResolver implements ShaResolver {
    private static final Logger log = LoggerFactory.getLogger(GitLsRemoteShaResolver.class);
    private static final Pattern SHA = Pattern.compile("[0-9a-f]{40}");

    private final CommandRunner runner;
    private final Path workDir;
    private final String baseUrl;
    private final Duration timeout;

    public GitLsRemoteShaResolver(CommandRunner runner, Path workDir, String baseUrl, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String resolve(String repository, String ref) {
        String url = baseUrl + "/" + repository;
        CommandRunner.Result result;
        try {
            result = runner.run(workDir, List.of("git", "ls-remote", url, ref, ref + "^{}"), timeout);
        } catch (IOException e) {
            throw new ResolutionException(ExitStatus.TOOL_MISSING, "git is not available: " + e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new ResolutionException("git ls-remote " + url + " timed out after " + timeout.toSeconds() + "s");
        }
        if (!result.succeeded()) {
            throw new ResolutionException("git ls-remote " + url + " failed: " + result.stderr().strip());
        }
        String sha = pick(result.stdout(), ref);
        if (sha == null) {
            throw new ResolutionException("No tag or branch named '" + ref + "' in " + repository);
        }
        log.debug("Resolved {}@{} to {}", repository, ref, sha);
        return sha;
    }

    static String pick(String lsRemoteOutput, String ref) {
        Map<String, String> byRef = new HashMap<>();
        for (String line : lsRemoteOutput.split("\\R")) {
            String[] parts = line.strip().split("\\s+");
            if (parts.length == 2 && SHA.matcher(parts[0]).matches()) byRef.put(parts[1], parts[0]);
        }
        for (String candidate : List.of("refs/tags/" + ref + "^{}", "refs/tags/" + ref, "refs/heads/" + ref)) {
            String sha = byRef.get(candidate);
            if (sha != null) return sha;
        }
        return null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
