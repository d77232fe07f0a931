/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core;

import io.pushgate.core.api.model.ExitStatus;
import java.util.Objects;

/** An operational error: aborts the current step and maps to a non-violation exit status. */
public class PushgateException extends RuntimeException {
    private final ExitStatus status;

    public PushgateException(ExitStatus status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
    }

    public PushgateException(ExitStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "status");
    }

    public ExitStatus status() {
        return status;
    }
}
