/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.hook;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.scan.ScanReport;
import io.pushgate.core.scan.SecretScanner;
import io.pushgate.core.source.ContentSource;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

public final class SecretScanStep implements HookStep {
    private final SecretScanner scanner;
    private final ContentSource source;
    private final boolean enabled;

    public SecretScanStep(SecretScanner scanner, ContentSource source, boolean enabled) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.source = Objects.requireNonNull(source, "source");
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "secret-scan";
    }

    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public ExitStatus run(PrintStream out) throws IOException {
        out.printf("Scanning for secrets (%s)...%n", source.mode().name().toLowerCase(Locale.ROOT));
        ScanReport report = scanner.scan(source);
        if (report.findings().isEmpty()) out.println("No secrets detected");
        return report.exitStatus();
    }
}
