package com.ailab.core.quota;

/**
 * Why a quota check failed, in the order the checks run.
 */
public enum QuotaDenialReason {
    GPU_QUOTA_EXCEEDED("gpu_quota_exceeded"),
    ENV_COUNT_EXCEEDED("env_count_exceeded"),
    MEMORY_QUOTA_EXCEEDED("memory_quota_exceeded");

    private final String code;

    QuotaDenialReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
