package com.ailab.core.quota;

import com.ailab.core.model.QuotaTier;

/**
 * What a user currently holds, next to what their tier allows.
 */
public record UserUsage(
    String userId,
    QuotaTier tier,
    int environments,
    int gpus,
    int memoryMb,
    QuotaPolicy policy
) {}
