/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code uses:}, {@code image:} or {@code container:} line split into the parts a rewrite has to keep:
 * indentation and list marker, key, separator, quoting and trailing comment.
 */
record WorkflowLine(String prefix, String key, String separator, String quote, String value, String suffix) {
    private static final Pattern KEYED =
            Pattern.compile("^(?<prefix>\\s*(?:-\\s+)?)(?<key>uses|image|container)(?<sep>:(?:\\s+|$))(?<rest>.*)$");
    private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s+#.*$|\\s+$");

    static Optional<WorkflowLine> parse(String raw) {
        Matcher m = KEYED.matcher(raw);
        if (!m.matches()) return Optional.empty();
        String rest = m.group("rest");

        String quote = "";
        String value;
        String suffix;
        if (!rest.isEmpty() && (rest.charAt(0) == '"' || rest.charAt(0) == '\'')) {
            char q = rest.charAt(0);
            int close = rest.indexOf(q, 1);
            if (close < 0) {
                value = rest.substring(1);
                suffix = "";
            } else {
                quote = String.valueOf(q);
                value = rest.substring(1, close);
                suffix = rest.substring(close + 1);
            }
        } else if (rest.startsWith("#")) {
            value = "";
            suffix = rest;
        } else {
            Matcher c = TRAILING_COMMENT.matcher(rest);
            int cut = c.find() ? c.start() : rest.length();
            value = rest.substring(0, cut);
            suffix = rest.substring(cut);
        }
        return Optional.of(new WorkflowLine(m.group("prefix"), m.group("key"), m.group("sep"), quote, value, suffix));
    }

    /** Number of leading spaces of the raw line; list markers do not count. */
    static int indentOf(String raw) {
        int i = 0;
        while (i < raw.length() && raw.charAt(i) == ' ') i++;
        return i;
    }

    static boolean isCommentOrBlank(String raw) {
        String t = raw.strip();
        return t.isEmpty() || t.startsWith("#");
    }

    /** Splits file content into lines; joining them back with the detected separator restores the file. */
    static List<String> lines(String content) {
        return Arrays.asList(content.split("\\r?\\n", -1));
    }

    static String separatorOf(String content) {
        return content.contains("\r\n") ? "\r\n" : "\n";
    }

    String comment() {
        String s = suffix.strip();
        return s.startsWith("#") ? s : "";
    }

    boolean opensBlock() {
        return value.isEmpty();
    }

    boolean isFlowMapping() {
        return quote.isEmpty() && value.startsWith("{");
    }

    /** Rebuilds the line around a new value, with {@code comment} (may be empty) after it. */
    String render(String newValue, String newComment) {
        StringBuilder sb = new StringBuilder(prefix).append(key).append(separator);
        if (separator.equals(":")) sb.append(' ');
        sb.append(quote).append(newValue).append(quote);
        if (!newComment.isEmpty()) sb.append(' ').append(newComment);
        return sb.toString();
    }
}
