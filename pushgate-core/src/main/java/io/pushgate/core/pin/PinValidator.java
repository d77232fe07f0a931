/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Read-only pass over a workflow directory: which references are not pinned to an immutable identifier. */
public final class PinValidator {
    private static final Logger log = LoggerFactory.getLogger(PinValidator.class);

    private final ReferenceExtractor extractor;

    public PinValidator() {
        this(new ReferenceExtractor());
    }

    public PinValidator(ReferenceExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public PinReport check(Path dir) throws IOException {
        List<Path> files = ReferenceExtractor.workflowFiles(dir);
        List<WorkflowReference> refs = new ArrayList<>();
        for (Path f : files) refs.addAll(extractor.extract(f));
        PinReport report = new PinReport(files.size(), refs);
        log.debug("Checked {} reference(s) in {} file(s), {} unpinned",
                refs.size(), files.size(), report.violations().size());
        return report;
    }

    /** Human-readable reason for a violation, as printed by the CLI and the hook. */
    public static String describe(WorkflowReference ref) {
        return switch (ref.kind()) {
            case ACTION -> ref.rawValue().startsWith(ReferenceKind.DOCKER_SCHEME)
                    ? "docker action not pinned: " + ref.rawValue()
                    : (ref.pinStatus() == PinStatus.MALFORMED
                            ? "unpinned action (missing @<sha>): " + ref.rawValue()
                            : "action ref not a 40-hex commit: " + ref.rawValue());
            case CONTAINER_IMAGE -> "container image not pinned: " + ref.rawValue();
            case SERVICE_IMAGE -> "service image not pinned: " + ref.rawValue();
        };
    }
}
