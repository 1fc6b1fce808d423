package com.ailab.core.error;

import com.ailab.core.quota.QuotaDenialReason;

/**
 * The user's tier does not allow the requested allocation. Surfaced verbatim, never retried.
 */
public class QuotaExceededException extends EnvironmentException {

    private final QuotaDenialReason denialReason;

    public QuotaExceededException(QuotaDenialReason denialReason, String message) {
        super(ErrorCode.QUOTA_EXCEEDED, denialReason.code(), message);
        this.denialReason = denialReason;
    }

    public QuotaDenialReason denialReason() {
        return denialReason;
    }
}
