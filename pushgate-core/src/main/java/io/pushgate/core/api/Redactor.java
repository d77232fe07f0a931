/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api;

import io.pushgate.core.api.model.DetectionResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Replaces secret value spans with a fixed placeholder, leaving key names and punctuation intact. */
public final class Redactor {
    public static final String PLACEHOLDER = "***REDACTED***";

    private Redactor() {}

    public static String redact(String line, List<DetectionResult.Span> spans) {
        if (line == null || line.isEmpty() || spans.isEmpty()) return line;
        List<DetectionResult.Span> merged = merge(spans);

        StringBuilder out = new StringBuilder(line.length() + 16);
        int pos = 0;
        for (DetectionResult.Span s : merged) {
            if (s.start() > pos) out.append(line, pos, s.start());
            out.append(PLACEHOLDER);
            pos = s.end();
        }
        if (pos < line.length()) out.append(line, pos, line.length());
        return out.toString();
    }

    /** Merge overlapping or touching spans (earliest start first, longer span wins). */
    static List<DetectionResult.Span> merge(List<DetectionResult.Span> spans) {
        List<DetectionResult.Span> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(DetectionResult.Span::start)
                .thenComparing(Comparator.comparingInt(DetectionResult.Span::end).reversed()));
        List<DetectionResult.Span> merged = new ArrayList<>(sorted.size());
        for (DetectionResult.Span s : sorted) {
            if (merged.isEmpty()) {
                merged.add(s);
                continue;
            }
            DetectionResult.Span last = merged.get(merged.size() - 1);
            if (s.start() <= last.end()) {
                if (s.end() > last.end()) {
                    merged.set(
                            merged.size() - 1,
                            new DetectionResult.Span(last.start(), s.end(), last.patternId(), last.category()));
                }
            } else {
                merged.add(s);
            }
        }
        return merged;
    }
}
