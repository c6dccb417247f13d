package com.valuerank.orchestration.domain;

import java.util.EnumSet;
import java.util.Set;

public enum RunStatus {
    PENDING,
    RUNNING,
    PAUSED,
    SUMMARIZING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<RunStatus> ACTIVE = EnumSet.of(PENDING, RUNNING, PAUSED, SUMMARIZING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
