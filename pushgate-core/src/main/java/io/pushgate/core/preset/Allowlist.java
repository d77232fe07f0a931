/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.preset;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Project-local allowlist: one regex per line, blank lines and {@code #} comments ignored.
 * A line matching any rule is exempt from every pattern.
 */
public final class Allowlist {
    private static final Allowlist EMPTY = new Allowlist(List.of());

    private final List<Pattern> rules;

    private Allowlist(List<Pattern> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Allowlist empty() {
        return EMPTY;
    }

    public static Allowlist of(List<String> regexes) {
        List<Pattern> rules = new ArrayList<>();
        int lineNo = 0;
        for (String raw : regexes) {
            lineNo++;
            String r = raw == null ? "" : raw.strip();
            if (r.isEmpty() || r.startsWith("#")) continue;
            try {
                rules.add(Pattern.compile(r));
            } catch (PatternSyntaxException e) {
                throw new PushgateException(
                        ExitStatus.CONFIG_ERROR, "Invalid allowlist regex on line " + lineNo + ": " + r, e);
            }
        }
        return rules.isEmpty() ? EMPTY : new Allowlist(rules);
    }

    /** Loads the allowlist file; a missing file means an empty allowlist. */
    public static Allowlist load(Path file) {
        if (file == null || !Files.isRegularFile(file)) return EMPTY;
        try {
            return of(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PushgateException(ExitStatus.CONFIG_ERROR, "Cannot read allowlist " + file, e);
        }
    }

    public boolean allows(String line) {
        for (Pattern rule : rules) {
            if (rule.matcher(line).find()) return true;
        }
        return false;
    }

    public int size() {
        return rules.size();
    }
}
