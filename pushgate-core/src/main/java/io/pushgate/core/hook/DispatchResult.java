/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import java.util.List;

public record DispatchResult(List<StepResult> steps) {

    public DispatchResult {
        steps = List.copyOf(steps);
    }

    public boolean blocked() {
        return steps.stream().anyMatch(StepResult::blocksPush);
    }

    /** OR-reduction of the step results: any blocking step blocks the push. */
    public ExitStatus verdict() {
        return blocked() ? ExitStatus.VIOLATIONS : ExitStatus.CLEAN;
    }
}
