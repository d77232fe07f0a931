/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts added lines from unified diff text (as printed by {@code git diff -U0}).
 *
 * <p>Removed lines and context lines never become targets; removed files ({@code +++ /dev/null}) are
 * skipped entirely.
 */
public final class UnifiedDiffParser {

    /** {@code @@ -12,3 +14,5 @@} : group 1 is the first line on the new side. */
    static final Pattern HUNK_HEADER = Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@.*");

    private UnifiedDiffParser() {}

    public static List<AddedLine> parse(String diff) {
        List<AddedLine> out = new ArrayList<>();
        if (diff == null || diff.isEmpty()) return out;

        String file = null;
        int newLine = 0;
        boolean inHunk = false;
        for (String line : diff.split("\\r?\\n", -1)) {
            if (line.startsWith("diff --git ")) {
                file = null;
                inHunk = false;
            } else if (!inHunk && line.startsWith("+++ ")) {
                file = targetPath(line.substring(4));
            } else if (line.startsWith("@@")) {
                Matcher m = HUNK_HEADER.matcher(line);
                inHunk = m.matches();
                if (inHunk) newLine = Integer.parseInt(m.group(1));
            } else if (inHunk && file != null) {
                if (line.startsWith("+")) {
                    out.add(new AddedLine(file, newLine, line.substring(1)));
                    newLine++;
                } else if (line.startsWith(" ")) {
                    newLine++;
                }
                // '-' lines and "\ No newline at end of file" do not advance the new side
            }
        }
        return out;
    }

    /** {@code b/src/App.java} → {@code src/App.java}; {@code /dev/null} → null. */
    static String targetPath(String header) {
        String p = header.strip();
        int tab = p.indexOf('\t');
        if (tab >= 0) p = p.substring(0, tab);
        if (p.length() >= 2 && p.startsWith("\"") && p.endsWith("\"")) p = p.substring(1, p.length() - 1);
        if (p.equals("/dev/null")) return null;
        return p.startsWith("b/") ? p.substring(2) : p;
    }
}
