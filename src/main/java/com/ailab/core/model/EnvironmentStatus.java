package com.ailab.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an {@link Environment}.
 *
 * <p>Non-terminal statuses hold their ports and GPU indices; terminal ones hold nothing
 * and are retained in the ledger for audit only.
 */
public enum EnvironmentStatus {
    REQUESTED,
    CREATING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED,
    ORPHANED;  // quarantined by the reconciler, holds no resources

    private static final Set<EnvironmentStatus> NON_TERMINAL = EnumSet.of(REQUESTED, CREATING, RUNNING, STOPPING);

    /**
     * @return true while the environment holds its port and GPU allocation
     */
    public boolean isActive() {
        return NON_TERMINAL.contains(this);
    }

    /**
     * @return true for statuses that mean a runtime call may be in flight
     */
    public boolean isInFlight() {
        return this == CREATING || this == STOPPING;
    }

    /**
     * Transitions the lifecycle manager may perform. {@code ORPHANED} is never a legal
     * target here; only the reconciler moves entries there.
     */
    public boolean canTransitionTo(EnvironmentStatus next) {
        return switch (this) {
            case REQUESTED -> next == CREATING || next == FAILED;
            case CREATING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == STOPPING || next == FAILED;
            case STOPPING -> next == STOPPED || next == FAILED;
            case STOPPED -> next == CREATING;
            case FAILED, ORPHANED -> false;
        };
    }
}
