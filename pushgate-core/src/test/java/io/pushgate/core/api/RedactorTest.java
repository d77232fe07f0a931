/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.api.model.DetectionResult.Span;
import io.pushgate.core.api.model.SecretCategory;
import java.util.List;
import org.junit.jupiter.api.Test;

class RedactorTest {

    @Test
    void replacesOnlyTheSecretValue() {
        String line = "api_key: \"abcd1234efgh5678\",";
        int start = line.indexOf("abcd");
        Span s = new Span(start, start + 16, "generic-assignment", SecretCategory.GENERIC_ASSIGNMENT);

        assertEquals("api_key: \"***REDACTED***\",", Redactor.redact(line, List.of(s)));
    }

    @Test
    void overlappingAndTouchingSpansCollapseIntoOnePlaceholder() {
        List<Span> spans = List.of(
                new Span(6, 12, "b", SecretCategory.BEARER_TOKEN),
                new Span(4, 8, "a", SecretCategory.BEARER_TOKEN),
                new Span(12, 14, "c", SecretCategory.BEARER_TOKEN),
                new Span(16, 18, "d", SecretCategory.BEARER_TOKEN));

        List<Span> merged = Redactor.merge(spans);

        assertEquals(2, merged.size());
        assertEquals(4, merged.get(0).start());
        assertEquals(14, merged.get(0).end());
        assertEquals("0123***REDACTED***ef***REDACTED***gh", Redactor.redact("0123456789abcdef45gh", spans));
    }

    @Test
    void noSpansLeavesTheLineAlone() {
        assertEquals("plain", Redactor.redact("plain", List.of()));
    }
}
