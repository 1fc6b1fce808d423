package com.ailab.core.lifecycle;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Environments with a runtime call in progress. The reconciler skips them, since their
 * ledger status and their container are expected to disagree until the call returns.
 */
@Component
public class InFlightRegistry {

    private final Set<String> envIds = ConcurrentHashMap.newKeySet();

    /**
     * Registers {@code envId}. Call while holding the ledger write lock that wrote the
     * in-flight status, so the reconciler never sees the status without the registration.
     */
    public void begin(String envId) {
        envIds.add(envId);
    }

    public void end(String envId) {
        envIds.remove(envId);
    }

    public boolean contains(String envId) {
        return envIds.contains(envId);
    }

    public Set<String> snapshot() {
        return Set.copyOf(envIds);
    }
}
