/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.preset;

import io.pushgate.core.api.Detector;
import io.pushgate.core.api.model.SecretCategory;
import io.pushgate.core.detect.GenericAssignmentDetector;
import io.pushgate.core.detect.RegexDetector;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the ordered list of secret patterns for one run.
 *
 * <h3>Ordering</h3>
 * <ul>
 *   <li><b>1.</b> Cloud credentials</li>
 *   <li><b>2.</b> Forge and platform tokens with a vendor prefix</li>
 *   <li><b>3.</b> Webhooks and private keys</li>
 *   <li><b>4.</b> Bearer tokens and JWTs</li>
 *   <li><b>5.</b> Database URLs with inline passwords</li>
 *   <li><b>6.</b> Generic {@code key = value} assignments</li>
 * </ul>
 * The first pattern that hits a line names its finding, so the most specific ones come first.
 */
public final class PatternCatalog {

    private final List<Detector> patterns;

    private PatternCatalog(List<Detector> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static EnumSet<SecretCategory> defaultCategories() {
        return EnumSet.allOf(SecretCategory.class);
    }

    public static PatternCatalog builtIn(ScanPolicy policy) {
        return build(defaultCategories(), policy);
    }

    /**
     * @param categories enabled categories (null or empty means all)
     * @param policy value thresholds for the generic assignment pattern (never null)
     */
    public static PatternCatalog build(Set<SecretCategory> categories, ScanPolicy policy) {
        Objects.requireNonNull(policy, "ScanPolicy cannot be null");
        EnumSet<SecretCategory> enabled = (categories == null || categories.isEmpty())
                ? defaultCategories()
                : EnumSet.copyOf(categories);

        List<Detector> out = new ArrayList<>();
        for (Detector d : fixedSignatures()) {
            if (enabled.contains(d.category())) out.add(d);
        }
        if (enabled.contains(SecretCategory.GENERIC_ASSIGNMENT)) out.add(new GenericAssignmentDetector(policy));
        return new PatternCatalog(out);
    }

    /** Catalog over an explicit pattern list, kept in the given order. */
    public static PatternCatalog of(List<Detector> patterns) {
        return new PatternCatalog(patterns);
    }

    public List<Detector> patterns() {
        return patterns;
    }

    public List<String> ids() {
        return patterns.stream().map(Detector::id).toList();
    }

    private static List<Detector> fixedSignatures() {
        return List.of(
                // --- 1) Cloud ---
                new RegexDetector("aws-access-key-id",
                        "\\b(?<secret>(?:A3T[A-Z0-9]|AKIA|ASIA|ABIA|ACCA)[A-Z0-9]{16})\\b",
                        SecretCategory.CLOUD_CREDENTIAL, true),
                new RegexDetector("aws-secret-access-key",
                        "(?i)aws_?secret_?(?:access_?)?key[\"']?\\s*[:=]\\s*[\"']?(?<secret>[A-Za-z0-9/+=]{40,})",
                        SecretCategory.CLOUD_CREDENTIAL, true),
                new RegexDetector("google-api-key",
                        "\\b(?<secret>AIza[0-9A-Za-z_-]{35})",
                        SecretCategory.CLOUD_CREDENTIAL, true),

                // --- 2) Forge / platform tokens ---
                new RegexDetector("github-token",
                        "\\b(?<secret>(?:ghp|gho|ghu|ghr|ghs)_[0-9A-Za-z]{36,255})\\b",
                        SecretCategory.FORGE_TOKEN, true),
                new RegexDetector("github-fine-grained-token",
                        "\\b(?<secret>(?:github|ghcr)_pat_[0-9A-Za-z_]{22,255})\\b",
                        SecretCategory.FORGE_TOKEN, true),
                new RegexDetector("gitlab-token",
                        "\\b(?<secret>glpat-[0-9A-Za-z_-]{20,})",
                        SecretCategory.FORGE_TOKEN, true),
                new RegexDetector("slack-token",
                        "\\b(?<secret>xox[baprsuonv]-[0-9A-Za-z-]{10,})",
                        SecretCategory.PLATFORM_TOKEN, true),
                new RegexDetector("stripe-live-key",
                        "\\b(?<secret>[sr]k_live_[0-9A-Za-z]{20,})",
                        SecretCategory.PLATFORM_TOKEN, true),
                new RegexDetector("openai-key",
                        "\\b(?<secret>sk-(?:proj-|svcacct-|admin-)?[A-Za-z0-9_-]{32,})",
                        SecretCategory.PLATFORM_TOKEN, true),
                new RegexDetector("docker-hub-token",
                        "\\b(?<secret>dckr_pat_[A-Za-z0-9_-]{20,})",
                        SecretCategory.PLATFORM_TOKEN, true),
                new RegexDetector("npm-token",
                        "\\b(?<secret>npm_[A-Za-z0-9]{36})\\b",
                        SecretCategory.PLATFORM_TOKEN, true),

                // --- 3) Webhooks / keys ---
                new RegexDetector("slack-webhook",
                        "https://hooks\\.slack\\.com/services/(?<secret>T[A-Za-z0-9_]+/B[A-Za-z0-9_]+/[A-Za-z0-9_]+)",
                        SecretCategory.WEBHOOK, true),
                new RegexDetector("discord-webhook",
                        "https://(?:ptb\\.|canary\\.)?discord(?:app)?\\.com/api/webhooks/[0-9]+/(?<secret>[A-Za-z0-9_-]{20,})",
                        SecretCategory.WEBHOOK, true),
                new RegexDetector("private-key",
                        "(?<secret>-----BEGIN[ A-Z0-9_-]{0,100}PRIVATE KEY(?: BLOCK)?-----)",
                        SecretCategory.PRIVATE_KEY, true),

                // --- 4) Bearer / JWT ---
                new RegexDetector("bearer-token",
                        "(?i)\\bbearer\\s+(?<secret>[A-Za-z0-9._~+/-]{20,}=*)",
                        SecretCategory.BEARER_TOKEN, false),
                new RegexDetector("jwt",
                        "\\b(?<secret>eyJ[A-Za-z0-9_+/-]{10,}={0,2}\\.eyJ[A-Za-z0-9_+/-]{10,}={0,2}\\.[A-Za-z0-9_+/-]{10,}={0,2})",
                        SecretCategory.BEARER_TOKEN, false),

                // --- 5) Connection strings ---
                new RegexDetector("database-url",
                        "(?i)\\b(?:postgres(?:ql)?|mysql|mariadb|mongodb(?:\\+srv)?|rediss?|amqps?|mssql|sqlserver)"
                                + "://[^:@/\\s]+:(?<secret>[^@/\\s]{3,})@",
                        SecretCategory.DATABASE_URL, false));
    }
}
