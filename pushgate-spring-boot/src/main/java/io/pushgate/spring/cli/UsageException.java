/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring.cli;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;

/** The command line itself is wrong; usage is printed along with the message. */
public class UsageException extends PushgateException {
    public UsageException(String message) {
        super(ExitStatus.VALIDATION_ERROR, message);
    }
}
