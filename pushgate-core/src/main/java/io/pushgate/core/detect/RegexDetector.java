/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.detect;

import io.pushgate.core.api.Detector;
import io.pushgate.core.api.model.DetectionResult;
import io.pushgate.core.api.model.SecretCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-signature detector. The secret value is the named group {@code (?<secret>...)} when the
 * pattern declares one, otherwise the whole match. Placeholder values never count as hits.
 */
public final class RegexDetector implements Detector {
    private static final String SECRET_GROUP = "secret";

    private final String id;
    private final Pattern pattern;
    private final SecretCategory category;
    private final boolean appliesToLockFiles;
    private final boolean hasSecretGroup;

    public RegexDetector(String id, String regex, SecretCategory category, boolean appliesToLockFiles) {
        this.id = id;
        this.pattern = Pattern.compile(regex);
        this.category = category;
        this.appliesToLockFiles = appliesToLockFiles;
        this.hasSecretGroup = regex.contains("(?<" + SECRET_GROUP + ">");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public SecretCategory category() {
        return category;
    }

    @Override
    public boolean appliesToLockFiles() {
        return appliesToLockFiles;
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    public DetectionResult detect(String line) {
        if (line == null || line.isEmpty()) return DetectionResult.empty();
        Matcher m = pattern.matcher(line);
        List<DetectionResult.Span> spans = new ArrayList<>();
        while (m.find()) {
            int start = hasSecretGroup ? m.start(SECRET_GROUP) : m.start();
            int end = hasSecretGroup ? m.end(SECRET_GROUP) : m.end();
            if (start < 0) continue; // optional group did not participate
            String value = line.substring(start, end);
            if (SecretValues.isPlaceholder(value) || SecretValues.isIndirect(value)) continue;
            spans.add(new DetectionResult.Span(start, end, id, category));
        }
        return DetectionResult.of(spans);
    }
}
