/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api.model;

import java.util.List;

public record DetectionResult(boolean found, List<Span> spans) {
    public static DetectionResult empty() {
        return new DetectionResult(false, List.of());
    }

    public static DetectionResult of(List<Span> spans) {
        return spans.isEmpty() ? empty() : new DetectionResult(true, List.copyOf(spans));
    }

    /** Secret value indices [start,end) inside the scanned line, with the pattern that captured them. */
    public record Span(int start, int end, String patternId, SecretCategory category) {}
}
