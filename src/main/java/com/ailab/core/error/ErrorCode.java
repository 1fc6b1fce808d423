package com.ailab.core.error;

/**
 * Stable reason codes surfaced to the UI layer. Never replaced by raw runtime messages.
 */
public enum ErrorCode {
    QUOTA_EXCEEDED("quota_exceeded"),
    PORTS_EXHAUSTED("ports_exhausted"),
    INSUFFICIENT_GPU_CAPACITY("insufficient_gpu_capacity"),
    ACCESS_DENIED("access_denied"),
    RUNTIME_UNAVAILABLE("runtime_unavailable"),
    RUNTIME_TIMEOUT("runtime_timeout"),
    RUNTIME_REJECTED("runtime_rejected"),
    LEDGER_CORRUPTION("ledger_corruption"),
    NOT_FOUND("not_found"),
    INVALID_STATE("invalid_state"),
    TEMPLATE_NOT_FOUND("template_not_found");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
