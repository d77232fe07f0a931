/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.report;

import io.pushgate.core.api.model.Finding;
import java.util.List;

public interface Reporter {
    void report(List<Finding> findings);
}
