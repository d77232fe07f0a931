/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.preset;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AllowlistTest {

    @TempDir
    Path dir;

    @Test
    void loadsOneRegexPerLineIgnoringCommentsAndBlanks() throws IOException {
        Path file = Files.writeString(dir.resolve("secret-allowlist.txt"), "# fixtures\n\nfake_[a-z]+_token\n  ^docs/ \n");

        Allowlist allowlist = Allowlist.load(file);

        assertEquals(2, allowlist.size());
        assertTrue(allowlist.allows("value = fake_stripe_token"));
        assertTrue(allowlist.allows("docs/guide.md"));
        assertFalse(allowlist.allows("real_token = abc"));
    }

    @Test
    void missingFileIsAnEmptyAllowlist() {
        Allowlist allowlist = Allowlist.load(dir.resolve("nope.txt"));

        assertEquals(0, allowlist.size());
        assertFalse(allowlist.allows("anything"));
    }

    @Test
    void invalidRegexIsAConfigError() {
        PushgateException e = assertThrows(PushgateException.class, () -> Allowlist.of(List.of("ok", "broken[")));

        assertEquals(ExitStatus.CONFIG_ERROR, e.status());
        assertTrue(e.getMessage().contains("line 2"));
    }
}
