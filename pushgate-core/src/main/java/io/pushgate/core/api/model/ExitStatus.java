/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api.model;

/** Process exit statuses shared by every command. Anything other than 0/1/2 is an operational error. */
public enum ExitStatus {
    CLEAN(0),
    VIOLATIONS(1),
    REMEDIATED(2), // autopin only: every violation was rewritten
    PERMISSION_ERROR(3),
    NETWORK_ERROR(4),
    IO_ERROR(5),
    TOOL_MISSING(6),
    VALIDATION_ERROR(7),
    CONFIG_ERROR(9);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isOperationalError() {
        return code > REMEDIATED.code;
    }

    /** Whether a pre-push step with this status must stop the push. */
    public boolean blocksPush() {
        return this != CLEAN && this != REMEDIATED;
    }
}
