package com.ailab.core.model;

/**
 * Named resource-limit profile assigned to a user.
 */
public enum QuotaTier {
    DEFAULT,
    PREMIUM,
    ENTERPRISE
}
