package com.lms.backend.modules.scan.domain;

import java.util.EnumSet;
import java.util.Set;

public enum ScanCycleState {
    START,
    FETCHING,
    CLASSIFYING,
    DISPATCHING,
    REPORTING,
    DONE,
    FAILED;

    public boolean canTransitionTo(ScanCycleState next) {
        return allowedNext().contains(next);
    }

    /**
     * @throws IllegalStateException when {@code next} is not reachable from this state
     */
    public ScanCycleState transitionTo(ScanCycleState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("illegal scan cycle transition " + this + " -> " + next);
        }
        return next;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    private Set<ScanCycleState> allowedNext() {
        return switch (this) {
            case START -> EnumSet.of(FETCHING);
            case FETCHING -> EnumSet.of(CLASSIFYING, FAILED);
            case CLASSIFYING -> EnumSet.of(DISPATCHING);
            case DISPATCHING -> EnumSet.of(REPORTING);
            case REPORTING -> EnumSet.of(DONE);
            case DONE, FAILED -> EnumSet.noneOf(ScanCycleState.class);
        };
    }
}
