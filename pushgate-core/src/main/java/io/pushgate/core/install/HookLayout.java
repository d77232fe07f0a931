/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.install;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Where pushgate puts its files inside a repository, and how it recognises the ones it generated. */
final class HookLayout {
    static final String MARKER = "Generated by pushgate";
    static final String CONFIG_FILE = "pushgate.yml";
    static final String ALLOWLIST_FILE = "secret-allowlist.txt";
    static final String CHAINED_HOOK = "50-security-pre-push";

    private final Path root;
    private final InstallOptions options;

    HookLayout(Path root, InstallOptions options) {
        this.root = root.toAbsolutePath().normalize();
        this.options = options;
    }

    static Path requireRepository(Path root) {
        Path git = root.toAbsolutePath().normalize().resolve(".git");
        if (!Files.isDirectory(git)) {
            throw new PushgateException(ExitStatus.VALIDATION_ERROR, "Not a git repository: " + root);
        }
        return git;
    }

    Path root() {
        return root;
    }

    Path stateDir() {
        return root.resolve(options.stateDir());
    }

    Path configFile() {
        return stateDir().resolve(CONFIG_FILE);
    }

    Path allowlistFile() {
        return stateDir().resolve(ALLOWLIST_FILE);
    }

    Path legacyHook() {
        return root.resolve(".git").resolve("hooks").resolve("pre-push");
    }

    Path hooksPathDir() {
        return root.resolve(options.hooksPathDir());
    }

    Path dispatcher() {
        return hooksPathDir().resolve("pre-push");
    }

    Path chainedHookDir() {
        return hooksPathDir().resolve("pre-push.d");
    }

    Path chainedHook() {
        return chainedHookDir().resolve(CHAINED_HOOK);
    }

    static boolean isGenerated(Path file) throws IOException {
        if (!Files.isRegularFile(file)) return false;
        try (InputStream in = Files.newInputStream(file)) {
            String head = new String(in.readNBytes(512), StandardCharsets.UTF_8);
            return head.contains(MARKER);
        }
    }

    static String template(String name) {
        String resource = "/io/pushgate/core/install/" + name + ".tmpl";
        try (InputStream in = HookLayout.class.getResourceAsStream(resource)) {
            if (in == null) throw new PushgateException(ExitStatus.CONFIG_ERROR, "Missing template " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PushgateException(ExitStatus.CONFIG_ERROR, "Cannot read template " + resource, e);
        }
    }
}
