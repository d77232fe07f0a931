/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.detect;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** Value heuristics shared by the detectors: placeholders, code references and entropy. */
public final class SecretValues {
    private SecretValues() {}

    private static final List<String> PLACEHOLDER_MARKERS = List.of(
            "example",
            "your_",
            "your-",
            "_here",
            "-here",
            "replace",
            "changeme",
            "change_me",
            "placeholder",
            "dummy",
            "sample",
            "xxxx",
            "redacted",
            "removed",
            "***",
            "...");

    private static final Pattern DOTTED_IDENTIFIER =
            Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)+$");
    private static final Pattern NUMERIC = Pattern.compile("^[0-9._:-]+$");

    /** Documentation placeholders such as {@code YOUR_PASSWORD_HERE}, {@code <INSERT_KEY>} or {@code ***}. */
    public static boolean isPlaceholder(String value) {
        if (value == null || value.isEmpty()) return true;
        if (value.startsWith("<")) return true;
        String lower = value.toLowerCase(Locale.ROOT);
        for (String marker : PLACEHOLDER_MARKERS) {
            if (lower.contains(marker)) return true;
        }
        return value.chars().distinct().count() == 1;
    }

    /** Values that point at a secret instead of containing one: env lookups, templates, identifiers, calls. */
    public static boolean isReference(String value) {
        return isIndirect(value) || (value != null && DOTTED_IDENTIFIER.matcher(value).matches());
    }

    /**
     * Environment lookups, template expressions and calls. Narrower than {@link #isReference}: a JWT is
     * a dotted identifier too, so fixed-signature patterns only use this check.
     */
    public static boolean isIndirect(String value) {
        if (value == null || value.isEmpty()) return false;
        if (value.startsWith("$") || value.contains("${") || value.contains("{{")) return true;
        if (value.contains("(")) return true;
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.contains("process.env") || lower.contains("os.environ") || lower.contains("getenv");
    }

    public static boolean isNumeric(String value) {
        return value != null && NUMERIC.matcher(value).matches();
    }

    /** Shannon entropy in bits per character. */
    public static double entropy(String value) {
        if (value == null || value.isEmpty()) return 0.0;
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < value.length(); i++) counts.merge(value.charAt(i), 1, Integer::sum);
        double len = value.length();
        double bits = 0.0;
        for (int c : counts.values()) {
            double p = c / len;
            bits -= p * (Math.log(p) / Math.log(2));
        }
        return bits;
    }
}
