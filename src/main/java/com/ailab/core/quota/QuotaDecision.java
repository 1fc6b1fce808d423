package com.ailab.core.quota;

import com.ailab.core.error.QuotaExceededException;

/**
 * Outcome of {@link QuotaEngine#canAllocate}.
 *
 * @param allowed true if the request fits
 * @param reason  first failing check, null when allowed
 * @param message human-readable detail, null when allowed
 * @param usage   usage the decision was based on
 */
public record QuotaDecision(boolean allowed, QuotaDenialReason reason, String message, UserUsage usage) {

    public static QuotaDecision allow(UserUsage usage) {
        return new QuotaDecision(true, null, null, usage);
    }

    public static QuotaDecision deny(QuotaDenialReason reason, String message, UserUsage usage) {
        return new QuotaDecision(false, reason, message, usage);
    }

    /**
     * @throws QuotaExceededException if the decision is a denial
     */
    public void orThrow() {
        if (!allowed) {
            throw new QuotaExceededException(reason, message);
        }
    }
}
