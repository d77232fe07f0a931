/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.txn.TransactionManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AutopinRewriterTest {

    private static final String CHECKOUT_SHA = "b4ffde65f46336ab88eb53be808477a3936bae11";
    private static final String NODE_SHA = "60edb5dd545a775178f52524783378180af0d1f8";
    private static final String DIGEST = "sha256:" + "d".repeat(64);

    @TempDir
    Path root;

    private Path workflows;
    private final Map<String, Integer> lookups = new HashMap<>();

    private final ShaResolver shas = (repository, ref) -> {
        lookups.merge(repository + "@" + ref, 1, Integer::sum);
        switch (repository) {
            case "actions/checkout":
                return CHECKOUT_SHA;
            case "actions/setup-node":
                return NODE_SHA.toUpperCase();
            default:
                throw new ResolutionException("No tag or branch named '" + ref + "' in " + repository);
        }
    };

    private final ImageDigestResolver digests = image -> {
        lookups.merge(image, 1, Integer::sum);
        return DIGEST;
    };

    private AutopinRewriter rewriter;

    @BeforeEach
    void setUp() throws IOException {
        workflows = Files.createDirectories(root.resolve(".github/workflows"));
        rewriter = new AutopinRewriter(
                new ReferenceExtractor(), shas, digests, new TransactionManager(Clock.systemUTC(), false));
    }

    @Test
    void floatingActionIsRewrittenToItsCommitWithTheTagAsComment() throws IOException {
        Path ci = write("ci.yml", "steps:\n  - uses: actions/checkout@v4\n");

        AutopinReport report = rewriter.autopin(workflows, false, false);

        assertEquals("steps:\n  - uses: actions/checkout@" + CHECKOUT_SHA + " # v4\n", Files.readString(ci));
        assertEquals(ExitStatus.REMEDIATED, report.exitStatus());
        assertEquals(1, report.pinned().size());
        assertEquals("actions/checkout@" + CHECKOUT_SHA, report.pinned().get(0).rewrittenValue());
        assertEquals(List.of(ci), report.filesChanged());
        assertEquals(ExitStatus.CLEAN, new PinValidator().check(workflows).exitStatus());
    }

    @Test
    void secondRunChangesNothing() throws IOException {
        Path ci = write("ci.yml", "steps:\n  - uses: actions/checkout@v4\n  - uses: ./local/action\n");
        rewriter.autopin(workflows, true, true);
        String once = Files.readString(ci);

        AutopinReport again = rewriter.autopin(workflows, true, true);

        assertEquals(once, Files.readString(ci));
        assertEquals(ExitStatus.CLEAN, again.exitStatus());
        assertTrue(again.filesChanged().isEmpty());
    }

    @Test
    void existingCommentIsKeptAfterTheTag() throws IOException {
        Path ci = write("ci.yml", String.join("\n",
                "steps:",
                "  - uses: actions/setup-node@v4 # toolchain",
                "  - uses: \"actions/checkout@v4\" # v4",
                ""));

        rewriter.autopin(workflows, true, false);

        assertEquals(String.join("\n",
                "steps:",
                "  - uses: actions/setup-node@" + NODE_SHA + " # v4 # toolchain",
                "  - uses: \"actions/checkout@" + CHECKOUT_SHA + "\" # v4",
                ""), Files.readString(ci));
    }

    @Test
    void eachRefIsResolvedOncePerRun() throws IOException {
        write("a.yml", "steps:\n  - uses: actions/checkout@v4\n  - uses: actions/checkout@v4\n");
        write("b.yml", "steps:\n  - uses: actions/checkout@v4\n");

        AutopinReport report = rewriter.autopin(workflows, true, false);

        assertEquals(3, report.pinned().size());
        assertEquals(1, lookups.get("actions/checkout@v4"));
    }

    @Test
    void unresolvableReferenceIsLeftAloneAndTheRestIsPinned() throws IOException {
        Path ci = write("ci.yml", String.join("\n",
                "steps:",
                "  - uses: someone/deleted-action@v1",
                "  - uses: actions/checkout@v4",
                "  - uses: someone/deleted-action@v1",
                ""));

        AutopinReport report = rewriter.autopin(workflows, true, false);

        assertEquals(ExitStatus.VIOLATIONS, report.exitStatus());
        assertEquals(2, report.unresolved().size());
        assertEquals(1, report.pinned().size());
        assertEquals(1, lookups.get("someone/deleted-action@v1"));
        String content = Files.readString(ci);
        assertTrue(content.contains("  - uses: someone/deleted-action@v1\n"));
        assertTrue(content.contains("  - uses: actions/checkout@" + CHECKOUT_SHA + " # v4\n"));
    }

    @Test
    void imagesOnlyLeavesActionsUntouched() throws IOException {
        Path ci = write("ci.yml", String.join("\n",
                "jobs:",
                "  build:",
                "    container:",
                "      image: node:20 # runtime",
                "    services:",
                "      db:",
                "        image: 'postgres:16'",
                "    steps:",
                "      - uses: docker://alpine:3.19",
                "      - uses: actions/checkout@v4",
                "  lint:",
                "    container: { image: python:3.12, options: --cpus 1 }",
                ""));

        AutopinReport report = rewriter.autopin(workflows, false, true);

        assertEquals(String.join("\n",
                "jobs:",
                "  build:",
                "    container:",
                "      image: node:20@" + DIGEST + " # runtime",
                "    services:",
                "      db:",
                "        image: 'postgres:16@" + DIGEST + "'",
                "    steps:",
                "      - uses: docker://alpine:3.19@" + DIGEST,
                "      - uses: actions/checkout@v4",
                "  lint:",
                "    container: { image: python:3.12@" + DIGEST + ", options: --cpus 1 }",
                ""), Files.readString(ci));
        assertEquals(ExitStatus.REMEDIATED, report.exitStatus());
        assertEquals(4, report.pinned().size());
        assertNull(lookups.get("actions/checkout@v4"));
    }

    @Test
    void flowMappingPinsTheImageValueEvenWhenItsTextAppearsEarlier() throws IOException {
        Path ci = write("flow.yml", String.join("\n",
                "jobs:",
                "  test:",
                "    container: { options: --label node:20, image: \"node:20\" }",
                ""));

        AutopinReport report = rewriter.autopin(workflows, false, true);

        assertEquals(String.join("\n",
                "jobs:",
                "  test:",
                "    container: { options: --label node:20, image: \"node:20@" + DIGEST + "\" }",
                ""), Files.readString(ci));
        assertEquals(ExitStatus.REMEDIATED, report.exitStatus());
        assertEquals(1, report.pinned().size());
    }

    @Test
    void imageExpressionCannotBePinned() throws IOException {
        write("matrix.yml", "jobs:\n  t:\n    container:\n      image: ${{ matrix.image }}\n");

        AutopinReport report = rewriter.autopin(workflows, false, true);

        assertEquals(ExitStatus.VIOLATIONS, report.exitStatus());
        assertTrue(report.unresolved().get(0).reason().contains("expression"));
        assertTrue(report.filesChanged().isEmpty());
    }

    @Test
    void windowsLineEndingsSurviveTheRewrite() throws IOException {
        Path ci = write("ci.yml", "steps:\r\n  - uses: actions/checkout@v4\r\n");

        rewriter.autopin(workflows, true, false);

        assertEquals("steps:\r\n  - uses: actions/checkout@" + CHECKOUT_SHA + " # v4\r\n", Files.readString(ci));
    }

    @Test
    void nothingToPinIsClean() throws IOException {
        write("ci.yml", "steps:\n  - uses: actions/checkout@" + CHECKOUT_SHA + " # v4\n");

        AutopinReport report = rewriter.autopin(workflows, true, true);

        assertEquals(ExitStatus.CLEAN, report.exitStatus());
        assertTrue(lookups.isEmpty());
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(workflows.resolve(name), content);
    }
}
