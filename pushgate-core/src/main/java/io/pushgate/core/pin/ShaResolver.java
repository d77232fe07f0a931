/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

/** Resolves a repository and a floating tag or branch to the 40-character commit it currently names. */
@FunctionalInterface
public interface ShaResolver {
    String resolve(String repository, String ref);
}
