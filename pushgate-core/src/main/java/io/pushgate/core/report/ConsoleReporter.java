/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.report;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.pushgate.core.api.model.Finding;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/** Prints every finding with file, line and category; the line itself is redacted unless told otherwise. */
public final class ConsoleReporter implements Reporter {
    private final PrintStream out;
    private final boolean redact;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The stream is the caller's output channel; it is written to, never exposed.")
    public ConsoleReporter(PrintStream out, boolean redact) {
        this.out = Objects.requireNonNull(out, "out");
        this.redact = redact;
    }

    @Override
    public void report(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return;
        for (Finding f : findings) {
            out.printf("   %s: [%s/%s] %s%n", f.location(), f.category(), f.patternId(), f.display(redact).strip());
        }
        out.printf("%d potential secret(s) found%n", findings.size());
    }
}
