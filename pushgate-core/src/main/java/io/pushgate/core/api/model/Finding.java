/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api.model;

/**
 * A single secret hit. Created per run, never persisted.
 *
 * @param file file the line came from
 * @param lineNumber 1-based line number
 * @param line the raw line; only ever printed when redaction is off
 * @param redactedLine the line with every captured secret value replaced by the placeholder
 * @param patternId id of the first catalog pattern that matched the line
 * @param category category of that pattern
 */
public record Finding(
        String file, int lineNumber, String line, String redactedLine, String patternId, SecretCategory category) {

    public String location() {
        return file + ":" + lineNumber;
    }

    public String display(boolean redact) {
        return redact ? redactedLine : line;
    }

    @Override
    public String toString() {
        // keep raw secrets out of accidental string conversion (logs, assertion messages)
        return "Finding[" + location() + ", " + patternId + "/" + category + "]";
    }
}
