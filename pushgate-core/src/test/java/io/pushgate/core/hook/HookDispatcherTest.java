/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class HookDispatcherTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final List<String> ran = new ArrayList<>();

    @Test
    void allCleanPasses() {
        DispatchResult result = dispatch(step("a", ExitStatus.CLEAN), step("b", ExitStatus.CLEAN));

        assertFalse(result.blocked());
        assertEquals(ExitStatus.CLEAN, result.verdict());
        assertTrue(output().contains("Pre-push checks passed"));
    }

    @Test
    void oneViolationBlocksButEveryStepStillRuns() {
        DispatchResult result = dispatch(
                step("secret-scan", ExitStatus.VIOLATIONS),
                step("pin-check", ExitStatus.CLEAN),
                step("large-file", ExitStatus.CLEAN));

        assertEquals(List.of("secret-scan", "pin-check", "large-file"), ran);
        assertTrue(result.blocked());
        assertEquals(ExitStatus.VIOLATIONS, result.verdict());
        assertTrue(output().contains("  [FAIL ] secret-scan"));
        assertTrue(output().contains("Pre-push checks failed: push blocked"));
    }

    @Test
    void remediatedDoesNotBlock() {
        DispatchResult result = dispatch(step("pin-check", ExitStatus.REMEDIATED));

        assertEquals(ExitStatus.CLEAN, result.verdict());
        assertTrue(output().contains("  [FIXED] pin-check"));
    }

    @Test
    void crashingStepsBecomeErrorsAndBlock() {
        DispatchResult result = dispatch(
                throwing("io", new IOException("disk gone")),
                throwing("perm", new AccessDeniedException("/repo/.git")),
                throwing("tool", new PushgateException(ExitStatus.TOOL_MISSING, "git not found")),
                throwing("bug", new IllegalStateException("boom")),
                step("after", ExitStatus.CLEAN));

        assertEquals(
                List.of(ExitStatus.IO_ERROR, ExitStatus.PERMISSION_ERROR, ExitStatus.TOOL_MISSING,
                        ExitStatus.IO_ERROR, ExitStatus.CLEAN),
                result.steps().stream().map(StepResult::status).collect(Collectors.toList()));
        assertEquals("git not found", result.steps().get(2).error());
        assertEquals(ExitStatus.VIOLATIONS, result.verdict());
        assertTrue(output().contains("  [ERROR] tool"));
        assertTrue(output().contains("perm: permission denied: /repo/.git"));
    }

    @Test
    void disabledStepIsSkippedWithoutRunning() throws IOException {
        HookStep disabled = mock(HookStep.class);
        when(disabled.name()).thenReturn("large-file");
        when(disabled.enabled()).thenReturn(false);

        DispatchResult result = dispatch(disabled, step("secret-scan", ExitStatus.CLEAN));

        verify(disabled, never()).run(any());
        assertTrue(result.steps().get(0).skipped());
        assertFalse(result.blocked());
        assertTrue(output().contains("  [SKIP ] large-file"));
    }

    private DispatchResult dispatch(HookStep... steps) {
        return new HookDispatcher(List.of(steps)).dispatch(out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private HookStep step(String name, ExitStatus status) {
        return new HookStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ExitStatus run(PrintStream out) {
                ran.add(name);
                return status;
            }
        };
    }

    private HookStep throwing(String name, Exception failure) {
        return new HookStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ExitStatus run(PrintStream out) throws IOException {
                ran.add(name);
                if (failure instanceof IOException io) throw io;
                throw (RuntimeException) failure;
            }
        };
    }
}
