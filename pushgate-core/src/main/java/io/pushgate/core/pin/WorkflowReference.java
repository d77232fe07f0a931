/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import java.nio.file.Path;

public record WorkflowReference(Path file, int lineNumber, ReferenceKind kind, String rawValue, PinStatus pinStatus) {

    public String location() {
        return file + ":" + lineNumber;
    }

    public boolean isViolation() {
        return pinStatus.isViolation();
    }
}
