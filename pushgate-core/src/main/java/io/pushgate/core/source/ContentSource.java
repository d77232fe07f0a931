/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.api.model.ScanTarget;
import java.io.IOException;
import java.util.List;

/** Yields the lines a scan inspects. Excluded paths are dropped here, never at the pattern stage. */
public interface ContentSource {
    ScanMode mode();

    List<ScanTarget> targets() throws IOException;
}
