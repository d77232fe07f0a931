/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.cli;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.api.model.ScanMode;
import io.pushgate.spring.PushgateProperties;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/** Parses the command line, runs the command and keeps its status for the process exit code. */
@Slf4j
public class PushgateCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private final GateCommands commands;
    private final PushgateProperties props;
    private final PrintStream err;
    private ExitStatus status = ExitStatus.CLEAN;

    public PushgateCommandRunner(GateCommands commands, PushgateProperties props, PrintStream err) {
        this.commands = commands;
        this.props = props;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        status = execute(args.getSourceArgs());
    }

    public ExitStatus execute(String... args) {
        try {
            return dispatch(CommandArgs.parse(args));
        } catch (UsageException e) {
            err.println("pushgate: " + e.getMessage());
            err.println(CommandArgs.USAGE);
            return e.status();
        } catch (PushgateException e) {
            return failed(e, e.status());
        } catch (IllegalArgumentException e) {
            // thresholds and policies reject out-of-range values from pushgate.* properties
            return failed(e, ExitStatus.CONFIG_ERROR);
        } catch (RuntimeException e) {
            return failed(e, ExitStatus.IO_ERROR);
        }
    }

    private ExitStatus failed(RuntimeException e, ExitStatus status) {
        log.debug("Command failed", e);
        err.println("pushgate: " + ((e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage()));
        return status;
    }

    private ExitStatus dispatch(CommandArgs cmd) {
        log.debug("Running {} with options {} and flags {}", cmd.command(), cmd.options(), cmd.flags());
        String workflows = props.getPin().getWorkflowsDir();
        return switch (cmd.command()) {
            case "scan" -> commands.scan(mode(cmd), redact(cmd));
            case "pincheck" -> commands.pincheck(cmd.option("dir").orElse(workflows));
            case "autopin" -> commands.autopin(
                    cmd.option("dir").orElse(workflows), cmd.flag("actions"), cmd.flag("images"), cmd.flag("quiet"));
            case "pre-push" -> commands.prePush();
            case "install" -> commands.install(cmd.flag("force"), cmd.flag("hooks-path"));
            case "uninstall" -> commands.uninstall();
            default -> throw new UsageException("Unknown command: " + cmd.command());
        };
    }

    private ScanMode mode(CommandArgs cmd) {
        try {
            return cmd.option("mode").map(ScanMode::parse).orElse(props.getScanner().getMode());
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private boolean redact(CommandArgs cmd) {
        if (cmd.flag("redact")) return true;
        if (cmd.flag("no-redact")) return false;
        return props.getScanner().isRedact();
    }

    @Override
    public int getExitCode() {
        return status.code();
    }

    public ExitStatus status() {
        return status;
    }
}
