/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

/** An autopin outcome for one reference: the value it was rewritten to. */
public record PinDecision(WorkflowReference reference, String rewrittenValue) {}
