/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

public enum PinStatus {
    PINNED,
    FLOATING_TAG,
    /** {@code ./} and {@code .github/} actions live in the repository itself and are always exempt. */
    LOCAL_PATH,
    MALFORMED;

    public boolean isViolation() {
        return this == FLOATING_TAG || this == MALFORMED;
    }
}
