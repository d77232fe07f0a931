/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

/** One line added by the staged change set, numbered on the new side of the diff. */
public record AddedLine(String file, int lineNumber, String text) {}
