/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import io.pushgate.core.api.model.ExitStatus;
import java.util.List;
import java.util.stream.Collectors;

public record PinReport(int filesChecked, List<WorkflowReference> references) {

    public PinReport {
        references = List.copyOf(references);
    }

    public List<WorkflowReference> violations() {
        return references.stream().filter(WorkflowReference::isViolation).collect(Collectors.toList());
    }

    public ExitStatus exitStatus() {
        return violations().isEmpty() ? ExitStatus.CLEAN : ExitStatus.VIOLATIONS;
    }
}
