/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.pin.AutopinReport;
import io.pushgate.core.pin.AutopinRewriter;
import io.pushgate.core.pin.PinReport;
import io.pushgate.core.pin.PinValidator;
import io.pushgate.core.pin.WorkflowReference;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Checks workflow pinning. When the check fails and an autopin rewriter is configured, the floating
 * references are pinned in place; a fully remediated tree does not block the push but the rewritten
 * files still have to be reviewed and committed.
 */
public final class PinCheckStep implements HookStep {
    private final PinValidator validator;
    private final AutopinRewriter autopin;
    private final Path workflowsDir;
    private final boolean enabled;

    /** @param autopin null disables the autopin fallback */
    public PinCheckStep(PinValidator validator, AutopinRewriter autopin, Path workflowsDir, boolean enabled) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.autopin = autopin;
        this.workflowsDir = Objects.requireNonNull(workflowsDir, "workflowsDir");
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "pin-check";
    }

    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public ExitStatus run(PrintStream out) throws IOException {
        out.println("Checking workflow pinning...");
        if (!Files.isDirectory(workflowsDir)) {
            out.println("No workflow directory at " + workflowsDir);
            return ExitStatus.CLEAN;
        }
        PinReport report = validator.check(workflowsDir);
        if (report.violations().isEmpty()) {
            out.printf("All %d reference(s) pinned%n", report.references().size());
            return ExitStatus.CLEAN;
        }
        for (WorkflowReference ref : report.violations()) {
            out.printf("   %s: %s%n", ref.location(), PinValidator.describe(ref));
        }
        if (autopin == null) return ExitStatus.VIOLATIONS;

        out.println("Attempting autopin...");
        AutopinReport fixed = autopin.autopin(workflowsDir, true, true);
        for (AutopinReport.Failure f : fixed.unresolved()) {
            out.printf("   %s: left unpinned (%s)%n", f.reference().location(), f.reason());
        }
        ExitStatus status = fixed.exitStatus();
        if (status == ExitStatus.REMEDIATED) {
            out.printf("Pinned %d reference(s) in %d file(s); review and commit the changes%n",
                    fixed.pinned().size(), fixed.filesChanged().size());
        }
        return status == ExitStatus.CLEAN ? ExitStatus.VIOLATIONS : status;
    }
}
