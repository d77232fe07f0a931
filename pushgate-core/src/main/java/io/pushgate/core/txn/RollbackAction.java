/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.txn;

import java.io.IOException;
import java.util.Objects;

/** The inverse of one forward mutation, replayed when a transaction does not commit. */
public interface RollbackAction {

    String description();

    void undo() throws IOException;

    static RollbackAction of(String description, Undo undo) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(undo, "undo");
        return new RollbackAction() {
            @Override
            public String description() {
                return description;
            }

            @Override
            public void undo() throws IOException {
                undo.run();
            }

            @Override
            public String toString() {
                return description;
            }
        };
    }

    @FunctionalInterface
    interface Undo {
        void run() throws IOException;
    }
}
