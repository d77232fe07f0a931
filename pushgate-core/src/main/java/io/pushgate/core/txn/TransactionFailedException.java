/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.txn;

import io.pushgate.core.PushgateException;
import io.pushgate.core.api.model.ExitStatus;

/** Thrown after a failed transaction has been rolled back. */
public class TransactionFailedException extends PushgateException {
    private final transient RollbackReport rollback;

    public TransactionFailedException(ExitStatus status, String message, Throwable cause, RollbackReport rollback) {
        super(status, message, cause);
        this.rollback = rollback;
    }

    public RollbackReport rollback() {
        return rollback;
    }
}
