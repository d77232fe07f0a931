/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.cli;

import java.util.*;

/**
 * Parsed command line: one command word plus its options. Options take {@code --name value} or
 * {@code --name=value}; Spring properties ({@code --pushgate.*}, {@code --spring.*}, {@code --logging.*})
 * are left for the environment and ignored here.
 */
public record CommandArgs(String command, Map<String, String> options, Set<String> flags) {

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: pushgate [--verbose] <command> [options]",
            "",
            "Commands:",
            "  scan [--mode staged|full] [--redact|--no-redact]   scan for secrets",
            "  pincheck [--dir <path>]                            check workflow references are pinned",
            "  autopin [--dir <path>] [--actions] [--images] [--quiet]",
            "                                                     pin floating workflow references in place",
            "  pre-push                                           run every enabled pre-push check",
            "  install [--force] [--hooks-path]                   install the pre-push hook",
            "  uninstall                                          remove the pre-push hook and its state",
            "",
            "Exit codes: 0 clean, 1 violations, 2 remediated by autopin, >2 operational error");

    private static final Map<String, Set<String>> VALUE_OPTIONS = Map.of(
            "scan", Set.of("mode"),
            "pincheck", Set.of("dir"),
            "autopin", Set.of("dir"));

    private static final Map<String, Set<String>> FLAG_OPTIONS = Map.of(
            "scan", Set.of("redact", "no-redact"),
            "pincheck", Set.of(),
            "autopin", Set.of("actions", "images", "quiet"),
            "pre-push", Set.of(),
            "install", Set.of("force", "hooks-path"),
            "uninstall", Set.of());

    private static final List<String> PASSTHROUGH_PREFIXES = List.of("--pushgate.", "--spring.", "--logging.");

    public CommandArgs {
        options = Map.copyOf(options);
        flags = Set.copyOf(flags);
    }

    public static CommandArgs parse(String... args) {
        String command = null;
        Map<String, String> options = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>();

        for (String arg : args) {
            if (isPassthrough(arg) || arg.equals("--verbose") || arg.equals("-v")) continue;
            if (command == null && !arg.startsWith("-")) {
                command = arg;
            } else {
                pending.add(arg);
            }
        }
        if (command == null) throw new UsageException("No command given");
        if (!FLAG_OPTIONS.containsKey(command)) throw new UsageException("Unknown command: " + command);

        Set<String> valueNames = VALUE_OPTIONS.getOrDefault(command, Set.of());
        Set<String> flagNames = FLAG_OPTIONS.get(command);
        for (int i = 0; i < pending.size(); i++) {
            String arg = pending.get(i);
            if (!arg.startsWith("--")) throw new UsageException("Unexpected argument: " + arg);
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (valueNames.contains(name)) {
                if (value == null) {
                    if (i + 1 >= pending.size()) throw new UsageException("--" + name + " needs a value");
                    value = pending.get(++i);
                }
                options.put(name, value);
            } else if (flagNames.contains(name) && value == null) {
                flags.add(name);
            } else {
                throw new UsageException("Unknown option for " + command + ": " + arg);
            }
        }
        if (flags.contains("redact") && flags.contains("no-redact")) {
            throw new UsageException("--redact and --no-redact are mutually exclusive");
        }
        return new CommandArgs(command, options, flags);
    }

    public static boolean isVerbose(String... args) {
        for (String a : args) {
            if (a.equals("--verbose") || a.equals("-v")) return true;
        }
        return false;
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    private static boolean isPassthrough(String arg) {
        for (String p : PASSTHROUGH_PREFIXES) {
            if (arg.startsWith(p)) return true;
        }
        return false;
    }
}
