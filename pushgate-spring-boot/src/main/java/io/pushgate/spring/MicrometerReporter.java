/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.pushgate.core.api.model.Finding;
import io.pushgate.core.report.Reporter;
import java.util.List;
import java.util.Objects;

/** Counts findings per pattern. The raw line never reaches the registry. */
public final class MicrometerReporter implements Reporter {
    static final String METRIC = "pushgate_secret_findings_total";

    private final MeterRegistry registry;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void report(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return;
        for (Finding f : findings) {
            registry.counter(METRIC, "pattern", f.patternId(), "category", f.category().name())
                    .increment();
        }
    }
}
