/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api.model;

import java.util.Locale;

public enum ScanMode {
    STAGED, // added lines of the staged change set
    FULL; // whole content of every tracked file

    public static ScanMode parse(String value) {
        if (value == null || value.isBlank()) return STAGED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scan mode: " + value + " (expected staged|full)", e);
        }
    }
}
