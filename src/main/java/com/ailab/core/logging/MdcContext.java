package com.ailab.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the environment manager's MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEnvironment(String envId, String ownerId) {
        MDC.put("envId", envId);
        if (ownerId != null) {
            MDC.put("ownerId", ownerId);
        }
    }

    public static void setReconcilePass(long pass) {
        MDC.put("reconcilePass", String.valueOf(pass));
    }

    public static void clearEnvironment() {
        MDC.remove("envId");
        MDC.remove("ownerId");
    }

    public static void clear() {
        clearEnvironment();
        MDC.remove("reconcilePass");
    }
}
