/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.preset;

import static org.junit.jupiter.api.Assertions.*;

import io.pushgate.core.api.model.SecretCategory;
import io.pushgate.core.detect.GenericAssignmentDetector;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PatternCatalogTest {

    private final ScanPolicy policy = ScanPolicy.defaults();

    @Test
    void fixedSignaturesComeBeforeTheGenericAssignment() {
        List<String> ids = PatternCatalog.builtIn(policy).ids();

        assertEquals("aws-access-key-id", ids.get(0));
        assertEquals(GenericAssignmentDetector.ID, ids.get(ids.size() - 1));
        assertEquals(ids.size(), Set.copyOf(ids).size(), "ids are unique");
    }

    @Test
    void onlyEnabledCategoriesAreBuilt() {
        PatternCatalog catalog = PatternCatalog.build(EnumSet.of(SecretCategory.WEBHOOK), policy);

        assertEquals(List.of("slack-webhook", "discord-webhook"), catalog.ids());
        assertTrue(catalog.patterns().stream().allMatch(d -> d.category() == SecretCategory.WEBHOOK));
    }

    @Test
    void emptySelectionMeansEverything() {
        assertEquals(PatternCatalog.builtIn(policy).ids(), PatternCatalog.build(Set.of(), policy).ids());
        assertEquals(PatternCatalog.builtIn(policy).ids(), PatternCatalog.build(null, policy).ids());
    }

    @Test
    void lockFileExemptionsAreTheNoisyPatterns() {
        List<String> skippedInLockFiles = PatternCatalog.builtIn(policy).patterns().stream()
                .filter(d -> !d.appliesToLockFiles())
                .map(d -> d.id())
                .toList();

        assertTrue(skippedInLockFiles.containsAll(List.of("bearer-token", "jwt", "database-url")));
        assertFalse(skippedInLockFiles.contains("aws-access-key-id"));
    }
}
