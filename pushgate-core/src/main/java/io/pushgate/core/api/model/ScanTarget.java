/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.api.model;

/**
 * One line handed to the scanner.
 *
 * @param file repository-relative path using {@code /} separators
 * @param line the raw line content, without line terminator
 * @param lineNumber 1-based line number on the new side of the change
 * @param origin which source produced the line
 */
public record ScanTarget(String file, String line, int lineNumber, ScanMode origin) {}
