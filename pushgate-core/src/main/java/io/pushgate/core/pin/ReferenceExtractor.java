/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks workflow files line by line and yields every third-party reference in them.
 *
 * <p>There is no YAML parser here. Block membership is tracked with two indentation thresholds: a
 * {@code container:} or {@code services:} key opens a block at its indentation, and the first later
 * line indented at or above that column closes it. Comments and blank lines never move the state.
 * Anything a real parser would read differently (anchors, block scalars, flow sequences) is out of reach
 * of this scanner.
 */
public final class ReferenceExtractor {
    static final Pattern FLOW_IMAGE = Pattern.compile("\\bimage\\s*:\\s*[\"']?([^\"',}\\s]+)");
    private static final Pattern SERVICES_KEY = Pattern.compile("^\\s*(?:-\\s+)?services:\\s*(?:#.*)?$");

    /** Indentation-bounded block: open at a column, closed by the first line at or left of it. */
    static final class BlockScope {
        private boolean open;
        private int indent;

        void enter(int indent) {
            this.open = true;
            this.indent = indent;
        }

        /** Closes the block if {@code lineIndent} leaves it; returns whether it is still open. */
        boolean track(int lineIndent) {
            if (open && lineIndent <= indent) open = false;
            return open;
        }

        boolean isOpen() {
            return open;
        }
    }

    /** Every {@code *.yml} / {@code *.yaml} file below {@code dir}, in path order. */
    public static List<Path> workflowFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new PushgateException(ExitStatus.VALIDATION_ERROR, "Workflow directory not found: " + dir);
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(ReferenceExtractor::isWorkflowFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static boolean isWorkflowFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    public List<WorkflowReference> extract(Path file) throws IOException {
        return extract(file, WorkflowLine.lines(Files.readString(file, StandardCharsets.UTF_8)));
    }

    public List<WorkflowReference> extract(Path file, List<String> lines) {
        List<WorkflowReference> out = new ArrayList<>();
        BlockScope container = new BlockScope();
        BlockScope services = new BlockScope();

        for (int i = 0; i < lines.size(); i++) {
            String raw = lines.get(i);
            if (WorkflowLine.isCommentOrBlank(raw)) continue;
            int lineNumber = i + 1;
            int indent = WorkflowLine.indentOf(raw);

            boolean inContainer = container.track(indent);
            boolean inServices = services.track(indent);

            if (SERVICES_KEY.matcher(raw).matches()) {
                services.enter(indent);
                continue;
            }

            WorkflowLine line = WorkflowLine.parse(raw).orElse(null);
            if (line == null) continue;

            switch (line.key()) {
                case "container" -> {
                    if (line.opensBlock()) {
                        container.enter(indent);
                    } else if (line.isFlowMapping()) {
                        Matcher m = FLOW_IMAGE.matcher(line.value());
                        String image = m.find() ? m.group(1) : "";
                        out.add(reference(file, lineNumber, ReferenceKind.CONTAINER_IMAGE, image));
                    } else {
                        out.add(reference(file, lineNumber, ReferenceKind.CONTAINER_IMAGE, line.value()));
                    }
                }
                case "image" -> {
                    if (inContainer) {
                        out.add(reference(file, lineNumber, ReferenceKind.CONTAINER_IMAGE, line.value()));
                    } else if (inServices) {
                        out.add(reference(file, lineNumber, ReferenceKind.SERVICE_IMAGE, line.value()));
                    }
                }
                case "uses" -> out.add(reference(file, lineNumber, ReferenceKind.ACTION, line.value()));
                default -> {
                    // KEYED only admits the three keys above
                }
            }
        }
        return out;
    }

    private static WorkflowReference reference(Path file, int lineNumber, ReferenceKind kind, String value) {
        return new WorkflowReference(file, lineNumber, kind, value, kind.classify(value));
    }
}
