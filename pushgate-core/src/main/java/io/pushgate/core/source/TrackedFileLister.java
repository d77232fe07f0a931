/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import java.io.IOException;
import java.util.List;

/** Repository-relative paths of every tracked file. */
@FunctionalInterface
public interface TrackedFileLister {
    List<String> trackedFiles() throws IOException;
}
