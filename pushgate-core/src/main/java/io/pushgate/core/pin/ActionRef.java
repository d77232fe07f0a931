/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code owner/repo[/path]@ref}, the shape of a remote action reference. */
public record ActionRef(String owner, String repo, String path, String ref) {
    private static final Pattern SHAPE =
            Pattern.compile("^(?<owner>[A-Za-z0-9_.-]+)/(?<repo>[A-Za-z0-9_.-]+)(?<path>(?:/[^@\\s]+)?)@(?<ref>[^@\\s]+)$");

    public static Optional<ActionRef> parse(String value) {
        if (value == null) return Optional.empty();
        Matcher m = SHAPE.matcher(value);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new ActionRef(m.group("owner"), m.group("repo"), m.group("path"), m.group("ref")));
    }

    /** {@code owner/repo}, the part that names a clonable repository. */
    public String repository() {
        return owner + "/" + repo;
    }

    public String withRef(String newRef) {
        return repository() + path + "@" + newRef;
    }
}
