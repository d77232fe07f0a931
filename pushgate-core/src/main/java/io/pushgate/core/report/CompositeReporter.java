/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.report;

import io.pushgate.core.api.model.Finding;
import java.util.List;

/** Fans findings out to several reporters, in order. */
public final class CompositeReporter implements Reporter {
    private final List<Reporter> delegates;

    public CompositeReporter(List<Reporter> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void report(List<Finding> findings) {
        for (Reporter r : delegates) r.report(findings);
    }
}
