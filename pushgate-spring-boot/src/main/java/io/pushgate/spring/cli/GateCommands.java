/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.cli;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.hook.HookDispatcher;
import io.pushgate.core.hook.LargeFileStep;
import io.pushgate.core.hook.PinCheckStep;
import io.pushgate.core.hook.SecretScanStep;
import io.pushgate.core.install.GateInstaller;
import io.pushgate.core.install.GateUninstaller;
import io.pushgate.core.install.InstallOptions;
import io.pushgate.core.install.InstallResult;
import io.pushgate.core.pin.AutopinReport;
import io.pushgate.core.pin.AutopinRewriter;
import io.pushgate.core.pin.PinDecision;
import io.pushgate.core.pin.PinReport;
import io.pushgate.core.pin.PinValidator;
import io.pushgate.core.pin.WorkflowReference;
import io.pushgate.core.preset.Allowlist;
import io.pushgate.core.preset.PatternCatalog;
import io.pushgate.core.preset.ScanPolicy;
import io.pushgate.core.report.CompositeReporter;
import io.pushgate.core.report.ConsoleReporter;
import io.pushgate.core.report.Reporter;
import io.pushgate.core.scan.ScanReport;
import io.pushgate.core.scan.SecretScanner;
import io.pushgate.core.source.ContentSource;
import io.pushgate.spring.PushgateProperties;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** The commands behind the CLI. Each returns the status the process exits with. */
@Slf4j
@RequiredArgsConstructor
public class GateCommands {
    private final PushgateProperties props;
    private final Path root;
    private final PatternCatalog catalog;
    private final ScanPolicy policy;
    private final Function<ScanMode, ContentSource> sources;
    private final Reporter metrics;
    private final PinValidator validator;
    private final AutopinRewriter autopin;
    private final GateInstaller installer;
    private final GateUninstaller uninstaller;
    private final PrintStream out;

    public ExitStatus scan(ScanMode mode, boolean redact) {
        ScanReport report;
        try {
            report = scanner(redact).scan(sources.apply(mode));
        } catch (IOException e) {
            throw operational(e);
        }
        if (report.findings().isEmpty()) {
            out.printf("No secrets detected (%d line(s) scanned)%n", report.linesScanned());
        }
        return report.exitStatus();
    }

    public ExitStatus pincheck(String dir) {
        Path workflows = resolve(dir);
        PinReport report;
        try {
            report = validator.check(workflows);
        } catch (IOException e) {
            throw operational(e);
        }
        for (WorkflowReference ref : report.violations()) {
            out.printf("   %s: %s%n", ref.location(), PinValidator.describe(ref));
        }
        if (report.violations().isEmpty()) {
            out.printf("All %d reference(s) in %d file(s) are pinned%n", report.references().size(), report.filesChecked());
        } else {
            out.printf("%d unpinned reference(s); run 'pushgate autopin' to pin them%n", report.violations().size());
        }
        return report.exitStatus();
    }

    public ExitStatus autopin(String dir, boolean actions, boolean images, boolean quiet) {
        AutopinReport report;
        try {
            report = autopin.autopin(resolve(dir), actions, images);
        } catch (IOException e) {
            throw operational(e);
        }
        if (!quiet) {
            for (PinDecision d : report.pinned()) {
                out.printf("   %s: %s -> %s%n", d.reference().location(), d.reference().rawValue(), d.rewrittenValue());
            }
        }
        for (AutopinReport.Failure f : report.unresolved()) {
            out.printf("   %s: left unpinned (%s)%n", f.reference().location(), f.reason());
        }
        if (!quiet || !report.unresolved().isEmpty()) {
            out.printf("Pinned %d reference(s), %d left unpinned%n", report.pinned().size(), report.unresolved().size());
        }
        return report.exitStatus();
    }

    public ExitStatus prePush() {
        PushgateProperties.Hook hook = props.getHook();
        PushgateProperties.Scanner sc = props.getScanner();
        HookDispatcher dispatcher = new HookDispatcher(List.of(
                new SecretScanStep(scanner(sc.isRedact()), sources.apply(sc.getMode()), hook.isSecretScan()),
                new PinCheckStep(
                        validator,
                        props.getPin().isAutopinOnFailure() ? autopin : null,
                        resolve(props.getPin().getWorkflowsDir()),
                        hook.isPinCheck()),
                new LargeFileStep(root, hook.getLargeFileMaxMb(), policy, hook.isLargeFileCheck())));
        return dispatcher.dispatch(out).verdict();
    }

    public ExitStatus install(boolean force, boolean hooksPath) {
        InstallOptions options = installOptions()
                .withForce(force)
                .withHooksPath(hooksPath || props.getInstall().isHooksPath());
        InstallResult result = installer.install(root, options);
        result.changed().forEach(p -> out.println("   installed " + root.relativize(p)));
        result.kept().forEach(p -> out.println("   kept " + root.relativize(p)));
        out.println("Pre-push security gate installed");
        return ExitStatus.CLEAN;
    }

    public ExitStatus uninstall() {
        InstallResult result = uninstaller.uninstall(root, installOptions());
        result.changed().forEach(p -> out.println("   removed " + root.relativize(p)));
        result.kept().forEach(p -> out.println("   kept " + root.relativize(p)));
        out.println("Pre-push security gate removed");
        return ExitStatus.CLEAN;
    }

    SecretScanner scanner(boolean redact) {
        Allowlist allowlist = Allowlist.load(resolve(props.getScanner().getAllowlistFile()));
        log.debug("Loaded {} allowlist rule(s)", allowlist.size());
        Reporter reporter = new CompositeReporter(List.of(new ConsoleReporter(out, redact), metrics));
        return new SecretScanner(catalog, allowlist, policy, reporter);
    }

    private InstallOptions installOptions() {
        PushgateProperties.Install install = props.getInstall();
        return new InstallOptions(false, install.isHooksPath(), install.getStateDir(), install.getHooksPathDir());
    }

    private Path resolve(String path) {
        return root.resolve(path).normalize();
    }

    static PushgateException operational(IOException e) {
        ExitStatus status = (e instanceof AccessDeniedException) ? ExitStatus.PERMISSION_ERROR : ExitStatus.IO_ERROR;
        return new PushgateException(status, e.toString(), e);
    }
}
