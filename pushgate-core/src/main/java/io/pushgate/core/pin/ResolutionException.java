/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.pin;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;

/** A floating reference could not be turned into an immutable identifier. */
public class ResolutionException extends PushgateException {

    public ResolutionException(String message) {
        super(ExitStatus.NETWORK_ERROR, message);
    }

    public ResolutionException(ExitStatus status, String message, Throwable cause) {
        super(status, message, cause);
    }
}
