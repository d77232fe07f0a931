/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import java.time.Duration;

/** @param error message of the operational error that ended the step, or null */
public record StepResult(String name, ExitStatus status, boolean skipped, Duration elapsed, String error) {

    public static StepResult skipped(String name) {
        return new StepResult(name, ExitStatus.CLEAN, true, Duration.ZERO, null);
    }

    public boolean blocksPush() {
        return !skipped && status.blocksPush();
    }

    String label() {
        if (skipped) return "SKIP";
        if (status.isOperationalError()) return "ERROR";
        return switch (status) {
            case CLEAN -> "PASS";
            case REMEDIATED -> "FIXED";
            default -> "FAIL";
        };
    }
}
