/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import java.util.regex.Pattern;

/**
 * The closed set of references a workflow can point at. Each kind owns the predicate that decides
 * whether a value is pinned.
 */
public enum ReferenceKind {
    /** A {@code uses:} value: {@code owner/repo[/path]@ref}, a local path or a {@code docker://} image. */
    ACTION {
        @Override
        public PinStatus classify(String value) {
            if (value == null || value.isBlank()) return PinStatus.MALFORMED;
            if (value.startsWith("./") || value.startsWith(".github/")) return PinStatus.LOCAL_PATH;
            if (value.startsWith(DOCKER_SCHEME)) return classifyImage(value.substring(DOCKER_SCHEME.length()));
            int at = value.lastIndexOf('@');
            if (at <= 0 || at == value.length() - 1) return PinStatus.MALFORMED;
            return COMMIT_SHA.matcher(value.substring(at + 1)).matches() ? PinStatus.PINNED : PinStatus.FLOATING_TAG;
        }
    },
    /** A job container image, either {@code container: img} or {@code image:} inside a {@code container:} block. */
    CONTAINER_IMAGE {
        @Override
        public PinStatus classify(String value) {
            return classifyImage(value);
        }
    },
    /** An {@code image:} inside a {@code services:} block. */
    SERVICE_IMAGE {
        @Override
        public PinStatus classify(String value) {
            return classifyImage(value);
        }
    };

    public static final String DOCKER_SCHEME = "docker://";
    public static final String DIGEST_MARKER = "@sha256:";
    static final Pattern COMMIT_SHA = Pattern.compile("[0-9a-fA-F]{40}");

    public abstract PinStatus classify(String value);

    public boolean isImage() {
        return this != ACTION;
    }

    private static PinStatus classifyImage(String value) {
        if (value == null || value.isBlank() || value.contains("${{")) return PinStatus.MALFORMED;
        return value.contains(DIGEST_MARKER) ? PinStatus.PINNED : PinStatus.FLOATING_TAG;
    }
}
