package com.ailab.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the lifecycle manager or the reconciler, consumed by the audit trail
 * and any other subscriber.
 *
 * @param eventType one of the type constants below
 * @param envId     the environment this event concerns (nullable for pass-level events)
 * @param ownerId   owner of the environment at the time of the event (nullable)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record EnvironmentEvent(
    String eventType,
    String envId,
    String ownerId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String CREATED = "environment.created";
    public static final String RUNNING = "environment.running";
    public static final String STOPPED = "environment.stopped";
    public static final String DESTROYED = "environment.destroyed";
    public static final String FAILED = "environment.failed";
    public static final String CLAIMED = "environment.claimed";
    public static final String QUOTA_DENIED = "quota.denied";
    public static final String ACCESS_DENIED = "access.denied";
    public static final String STALE_FAILED = "reconcile.stale_failed";
    public static final String ORPHAN_ADOPTED = "reconcile.orphan_adopted";
    public static final String DRIFT_CORRECTED = "reconcile.drift_corrected";
    public static final String CONFLICT_QUARANTINED = "reconcile.conflict_quarantined";
    public static final String LEDGER_CORRUPTION = "ledger.corruption";
    public static final String RECONCILED = "reconcile.completed";

    public EnvironmentEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
