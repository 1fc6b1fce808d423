package com.ailab.core.model;

import java.time.Instant;

/**
 * A workspace user. Recorded in the ledger on the first successful allocation and never deleted.
 *
 * @param id          stable identifier (usually the e-mail the proxy authenticated)
 * @param quotaTier   tier the user was on when first seen
 * @param firstSeenAt time of the first successful allocation
 */
public record User(String id, QuotaTier quotaTier, Instant firstSeenAt) {}
