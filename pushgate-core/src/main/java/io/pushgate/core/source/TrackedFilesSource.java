/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.api.model.ScanTarget;
import io.pushgate.core.preset.ScanPolicy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entire content of every tracked file (full mode). Binary and missing files are skipped. */
public final class TrackedFilesSource implements ContentSource {
    private static final Logger log = LoggerFactory.getLogger(TrackedFilesSource.class);
    private static final int BINARY_SNIFF_BYTES = 8000;

    private final Path repoRoot;
    private final TrackedFileLister lister;
    private final ScanPolicy policy;

    public TrackedFilesSource(Path repoRoot, TrackedFileLister lister, ScanPolicy policy) {
        this.repoRoot = repoRoot;
        this.lister = lister;
        this.policy = policy;
    }

    @Override
    public ScanMode mode() {
        return ScanMode.FULL;
    }

    @Override
    public List<ScanTarget> targets() throws IOException {
        List<ScanTarget> out = new ArrayList<>();
        for (String file : lister.trackedFiles()) {
            if (policy.isExcluded(file)) continue;
            Path path = repoRoot.resolve(file);
            if (!Files.isRegularFile(path)) {
                log.debug("Skipping tracked file missing from working tree: {}", file);
                continue;
            }
            try {
                if (isBinary(path)) {
                    log.debug("Skipping binary file: {}", file);
                    continue;
                }
                int lineNo = 0;
                for (String line : readLines(path)) {
                    out.add(new ScanTarget(file, line, ++lineNo, ScanMode.FULL));
                }
            } catch (AccessDeniedException e) {
                throw new PushgateException(ExitStatus.PERMISSION_ERROR, "Cannot read " + file, e);
            }
        }
        return out;
    }

    static boolean isBinary(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(BINARY_SNIFF_BYTES);
            for (byte b : head) {
                if (b == 0) return true;
            }
            return false;
        }
    }

    private static List<String> readLines(Path path) throws IOException {
        // tolerate non-UTF-8 text: malformed bytes become U+FFFD instead of failing the scan
        var decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            return reader.lines().toList();
        }
    }
}
