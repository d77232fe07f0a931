/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.io.PrintStream;

/** One independent push-time check. Steps share no mutable state. */
public interface HookStep {

    String name();

    /** Disabled steps are reported as skipped and never run. */
    default boolean enabled() {
        return true;
    }

    /** Runs the check, writing user-facing output to {@code out}. */
    ExitStatus run(PrintStream out) throws IOException;
}
