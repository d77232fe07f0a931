/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.scan;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.api.model.Finding;
import io.pushgate.core.api.model.ScanMode;
import java.util.List;

/** Outcome of one scan: every finding, in source order. */
public record ScanReport(ScanMode mode, int linesScanned, List<Finding> findings) {

    public ScanReport {
        findings = List.copyOf(findings);
    }

    public ExitStatus exitStatus() {
        return findings.isEmpty() ? ExitStatus.CLEAN : ExitStatus.VIOLATIONS;
    }
}
