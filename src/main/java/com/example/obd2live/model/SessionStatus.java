package com.example.obd2live.model;

import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    ERROR,
    CANCELLED;

    /**
     * Transitions reachable through a plain status update. COMPLETED is never
     * listed here: a session only completes by being ended.
     */
    public Set<SessionStatus> updatableTo() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(PAUSED, ERROR, CANCELLED);
            case PAUSED:
                return EnumSet.of(ACTIVE, ERROR, CANCELLED);
            default:
                return EnumSet.noneOf(SessionStatus.class);
        }
    }

    public boolean canUpdateTo(SessionStatus next) {
        return updatableTo().contains(next);
    }

    /**
     * Statuses after which no more data is accepted and no runtime state is kept.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }
}
