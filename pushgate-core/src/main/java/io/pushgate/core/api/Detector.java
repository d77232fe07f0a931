/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api;

import io.pushgate.core.api.model.DetectionResult;
import io.pushgate.core.api.model.SecretCategory;

/** Stateless secret pattern that returns the spans (start..end) of secret values found in one line. */
public interface Detector {
    String id();

    SecretCategory category();

    /** Lock files are only checked by detectors that return true here. */
    default boolean appliesToLockFiles() {
        return true;
    }

    DetectionResult detect(String line);
}
