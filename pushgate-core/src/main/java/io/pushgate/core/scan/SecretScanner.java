/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.scan;

import io.pushgate.core.api.Detector;
import io.pushgate.core.api.Redactor;
import io.pushgate.core.api.model.DetectionResult;
import io.pushgate.core.api.model.Finding;
import io.pushgate.core.api.model.ScanTarget;
import io.pushgate.core.preset.Allowlist;
import io.pushgate.core.preset.PatternCatalog;
import io.pushgate.core.preset.ScanPolicy;
import io.pushgate.core.report.NoopReporter;
import io.pushgate.core.report.Reporter;
import io.pushgate.core.source.ContentSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the pattern catalog to every line of a {@link ContentSource}.
 *
 * <p>A line is a finding iff at least one pattern matches it and no allowlist rule does. Scanning is
 * exhaustive: it never stops at the first hit. Lock files still go through the allowlist but only
 * through the patterns that {@linkplain Detector#appliesToLockFiles() apply to them}.
 */
public final class SecretScanner {
    private static final Logger log = LoggerFactory.getLogger(SecretScanner.class);

    private final PatternCatalog catalog;
    private final Allowlist allowlist;
    private final ScanPolicy policy;
    private final Reporter reporter;

    public SecretScanner(PatternCatalog catalog, Allowlist allowlist, ScanPolicy policy) {
        this(catalog, allowlist, policy, new NoopReporter());
    }

    public SecretScanner(PatternCatalog catalog, Allowlist allowlist, ScanPolicy policy, Reporter reporter) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.allowlist = (allowlist == null) ? Allowlist.empty() : allowlist;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.reporter = (reporter == null) ? new NoopReporter() : reporter;
    }

    public ScanReport scan(ContentSource source) throws IOException {
        List<ScanTarget> targets = source.targets();
        log.debug("Scanning {} line(s) in {} mode with {} pattern(s)",
                targets.size(), source.mode(), catalog.patterns().size());

        List<Finding> findings = new ArrayList<>();
        for (ScanTarget t : targets) {
            inspect(t).ifPresent(f -> {
                log.debug("Secret pattern {} matched at {}", f.patternId(), f.location());
                findings.add(f);
            });
        }
        ScanReport report = new ScanReport(source.mode(), targets.size(), findings);
        reporter.report(report.findings());
        return report;
    }

    /** Checks a single line; at most one finding per line, named after the first matching pattern. */
    public Optional<Finding> inspect(ScanTarget target) {
        String line = target.line();
        if (line == null || line.isEmpty()) return Optional.empty();
        if (allowlist.allows(line)) return Optional.empty();

        boolean lockFile = policy.isLockFile(target.file());
        List<DetectionResult.Span> spans = new ArrayList<>();
        Detector first = null;
        for (Detector d : catalog.patterns()) {
            if (lockFile && !d.appliesToLockFiles()) continue;
            DetectionResult r = d.detect(line);
            if (!r.found()) continue;
            if (first == null) first = d;
            spans.addAll(r.spans());
        }
        if (first == null) return Optional.empty();
        return Optional.of(new Finding(
                target.file(),
                target.lineNumber(),
                line,
                Redactor.redact(line, spans),
                first.id(),
                first.category()));
    }
}
