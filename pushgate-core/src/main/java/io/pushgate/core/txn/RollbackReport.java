/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.txn;

import java.util.List;

/** What a rollback did: how many inverse actions ran and which of them failed. */
public record RollbackReport(String transaction, int executed, List<String> failures) {

    public RollbackReport {
        failures = List.copyOf(failures);
    }

    public boolean clean() {
        return failures.isEmpty();
    }
}
