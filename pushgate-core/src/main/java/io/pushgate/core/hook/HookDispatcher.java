/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.AccessDeniedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every step in order and folds their exit statuses into one verdict. A failing or crashing step
 * never stops the ones after it, so one run reports every problem.
 */
public final class HookDispatcher {
    private static final Logger log = LoggerFactory.getLogger(HookDispatcher.class);

    private final List<HookStep> steps;

    public HookDispatcher(List<HookStep> steps) {
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    }

    public List<HookStep> steps() {
        return steps;
    }

    public DispatchResult dispatch(PrintStream out) {
        List<StepResult> results = new ArrayList<>(steps.size());
        for (HookStep step : steps) {
            if (!step.enabled()) {
                results.add(StepResult.skipped(step.name()));
                continue;
            }
            results.add(runStep(step, out));
        }
        DispatchResult result = new DispatchResult(results);
        printSummary(result, out);
        return result;
    }

    private StepResult runStep(HookStep step, PrintStream out) {
        long start = System.nanoTime();
        ExitStatus status;
        String error = null;
        try {
            status = step.run(out);
        } catch (PushgateException e) {
            status = e.status();
            error = e.getMessage();
        } catch (AccessDeniedException e) {
            status = ExitStatus.PERMISSION_ERROR;
            error = "permission denied: " + e.getFile();
        } catch (IOException | RuntimeException e) {
            status = ExitStatus.IO_ERROR;
            error = e.toString();
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (error != null) {
            log.error("Step {} failed: {}", step.name(), error);
            out.printf("%s: %s%n", step.name(), error);
        } else {
            log.debug("Step {} finished with {} in {} ms", step.name(), status, elapsed.toMillis());
        }
        return new StepResult(step.name(), status, false, elapsed, error);
    }

    private static void printSummary(DispatchResult result, PrintStream out) {
        out.println();
        out.println("Summary:");
        for (StepResult s : result.steps()) {
            out.printf("  [%-5s] %s%n", s.label(), s.name());
        }
        out.println(result.blocked()
                ? "Pre-push checks failed: push blocked"
                : "Pre-push checks passed");
    }
}
