/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

/** Resolves an image reference to the {@code sha256:<hex>} digest of its manifest. */
@FunctionalInterface
public interface ImageDigestResolver {
    String resolve(String image);
}
