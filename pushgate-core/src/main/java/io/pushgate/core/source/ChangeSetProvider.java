/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import java.io.IOException;
import java.util.List;

/** Supplies the ordered {@code (file, added-line)} pairs of the staged change set. */
@FunctionalInterface
public interface ChangeSetProvider {
    List<AddedLine> addedLines() throws IOException;
}
