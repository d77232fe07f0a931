/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.detect;

import io.pushgate.core.api.Detector;
import io.pushgate.core.api.model.DetectionResult;
import io.pushgate.core.api.model.SecretCategory;
import io.pushgate.core.preset.ScanPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catches {@code key [:=] value} assignments whose key names a credential and whose value looks random.
 *
 * <p>Only the value is captured, so redaction keeps the key, the separator and any quotes. A value is
 * reported when all of these hold:
 * <ul>
 *   <li>it is at least {@link ScanPolicy#minSecretLength()} characters long,</li>
 *   <li>it is not a documentation placeholder ({@code YOUR_PASSWORD_HERE}, {@code <INSERT_KEY>}),</li>
 *   <li>it is not a reference to a secret ({@code process.env.TOKEN}, {@code ${DB_PASS}}),</li>
 *   <li>it is not purely numeric,</li>
 *   <li>its Shannon entropy reaches {@link ScanPolicy#minEntropy()}.</li>
 * </ul>
 *
 * <p>Skipped for lock files, where integrity hashes would otherwise trip it constantly.
 */
public final class GenericAssignmentDetector implements Detector {
    public static final String ID = "generic-assignment";

    // key: any identifier containing a credential word; separator ':' '=' or ':=' (but not '==')
    private static final Pattern ASSIGNMENT = Pattern.compile("(?i)(?<key>[A-Za-z0-9_.-]*"
            + "(?:secret|passw(?:or)?d|pwd|api[_.-]?key|access[_.-]?key|private[_.-]?key|auth[_.-]?token|token|credentials?)"
            + "[A-Za-z0-9_.-]*)[\"']?\\s*(?::=|[:=](?!=))\\s*[\"'`]?(?<secret>[^\\s\"'`,;]+)");

    private final int minLength;
    private final double minEntropy;

    public GenericAssignmentDetector(ScanPolicy policy) {
        ScanPolicy p = (policy == null) ? ScanPolicy.defaults() : policy;
        this.minLength = p.minSecretLength();
        this.minEntropy = p.minEntropy();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SecretCategory category() {
        return SecretCategory.GENERIC_ASSIGNMENT;
    }

    @Override
    public boolean appliesToLockFiles() {
        return false;
    }

    @Override
    public DetectionResult detect(String line) {
        if (line == null || line.isEmpty()) return DetectionResult.empty();
        Matcher m = ASSIGNMENT.matcher(line);
        List<DetectionResult.Span> spans = new ArrayList<>();
        while (m.find()) {
            String value = m.group("secret");
            if (isPlausibleSecret(value)) {
                spans.add(new DetectionResult.Span(m.start("secret"), m.end("secret"), ID, category()));
            }
        }
        return DetectionResult.of(spans);
    }

    private boolean isPlausibleSecret(String value) {
        if (value.length() < minLength) return false;
        if (SecretValues.isPlaceholder(value)) return false;
        if (SecretValues.isReference(value)) return false;
        if (SecretValues.isNumeric(value)) return false;
        return SecretValues.entropy(value) >= minEntropy;
    }
}
