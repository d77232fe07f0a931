/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import io.pushgate.core.api.model.ExitStatus;
import java.nio.file.Path;
import java.util.List;

/**
 * Result of an autopin run.
 *
 * @param pinned references rewritten to an immutable form
 * @param unresolved references in scope that are still unpinned, with the reason
 * @param filesChanged files that were rewritten
 */
public record AutopinReport(List<PinDecision> pinned, List<Failure> unresolved, List<Path> filesChanged) {

    public record Failure(WorkflowReference reference, String reason) {}

    public AutopinReport {
        pinned = List.copyOf(pinned);
        unresolved = List.copyOf(unresolved);
        filesChanged = List.copyOf(filesChanged);
    }

    /** {@code REMEDIATED} when everything in scope got pinned, {@code VIOLATIONS} when anything is left. */
    public ExitStatus exitStatus() {
        if (!unresolved.isEmpty()) return ExitStatus.VIOLATIONS;
        return pinned.isEmpty() ? ExitStatus.CLEAN : ExitStatus.REMEDIATED;
    }
}
