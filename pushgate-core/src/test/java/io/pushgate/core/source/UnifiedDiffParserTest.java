/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class UnifiedDiffParserTest {

    @Test
    void numbersAddedLinesFromTheNewSideOfEachHunk() {
        String diff = String.join("\n",
                "diff --git a/src/App.java b/src/App.java",
                "--- a/src/App.java",
                "+++ b/src/App.java",
                "@@ -10,0 +11,2 @@ class App {",
                "+    String a = \"x\";",
                "+    String b = \"y\";",
                "@@ -40 +42 @@",
                "-    old();",
                "+    renamed();",
                "");

        List<AddedLine> lines = UnifiedDiffParser.parse(diff);

        assertEquals(List.of(
                new AddedLine("src/App.java", 11, "    String a = \"x\";"),
                new AddedLine("src/App.java", 12, "    String b = \"y\";"),
                new AddedLine("src/App.java", 42, "    renamed();")), lines);
    }

    @Test
    void contextLinesAdvanceButAreNotReported() {
        String diff = String.join("\n",
                "diff --git a/a.txt b/a.txt",
                "--- a/a.txt",
                "+++ b/a.txt",
                "@@ -1,3 +1,3 @@",
                " keep",
                "-gone",
                "+new",
                " tail",
                "\\ No newline at end of file");

        assertEquals(List.of(new AddedLine("a.txt", 2, "new")), UnifiedDiffParser.parse(diff));
    }

    @Test
    void handlesSeveralFilesAndSkipsDeletedOnes() {
        String diff = String.join("\n",
                "diff --git a/gone.txt b/gone.txt",
                "deleted file mode 100644",
                "--- a/gone.txt",
                "+++ /dev/null",
                "@@ -1 +0,0 @@",
                "-secret",
                "diff --git a/new.txt b/new.txt",
                "new file mode 100644",
                "--- /dev/null",
                "+++ b/new.txt",
                "@@ -0,0 +1 @@",
                "+++ looks like a header but is content");

        assertEquals(List.of(new AddedLine("new.txt", 1, "++ looks like a header but is content")),
                UnifiedDiffParser.parse(diff));
    }

    @Test
    void targetPathStripsPrefixQuotesAndTimestamps() {
        assertEquals("dir/file name.txt", UnifiedDiffParser.targetPath("\"b/dir/file name.txt\""));
        assertEquals("x.txt", UnifiedDiffParser.targetPath("b/x.txt\t2025-01-01 10:00:00"));
        assertNull(UnifiedDiffParser.targetPath("/dev/null"));
    }

    @Test
    void emptyDiffHasNoLines() {
        assertTrue(UnifiedDiffParser.parse("").isEmpty());
        assertTrue(UnifiedDiffParser.parse(null).isEmpty());
    }
}
