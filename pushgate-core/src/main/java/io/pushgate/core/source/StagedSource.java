/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.core.source;

import io.pushgate.core.api.model.ScanMode;
import io.pushgate.core.api.model.ScanTarget;
import io.pushgate.core.preset.ScanPolicy;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Added lines of the staged change set; removed and unstaged lines are never seen. */
public final class StagedSource implements ContentSource {
    private final ChangeSetProvider changeSet;
    private final ScanPolicy policy;

    public StagedSource(ChangeSetProvider changeSet, ScanPolicy policy) {
        this.changeSet = changeSet;
        this.policy = policy;
    }

    @Override
    public ScanMode mode() {
        return ScanMode.STAGED;
    }

    @Override
    public List<ScanTarget> targets() throws IOException {
        List<ScanTarget> out = new ArrayList<>();
        for (AddedLine added : changeSet.addedLines()) {
            if (policy.isExcluded(added.file())) continue;
            out.add(new ScanTarget(added.file(), added.text(), added.lineNumber(), ScanMode.STAGED));
        }
        return out;
    }
}
