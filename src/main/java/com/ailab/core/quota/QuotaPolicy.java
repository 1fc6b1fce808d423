package com.ailab.core.quota;

/**
 * Limits that apply to every user on a tier.
 *
 * @param maxEnvironments non-terminal environments a user may hold at once
 * @param maxGpus         GPUs a user may hold across those environments
 * @param maxMemoryMb     container memory a user may hold across those environments
 * @param highPriority    whether the allocator may hand this tier GPUs above the busy threshold
 */
public record QuotaPolicy(int maxEnvironments, int maxGpus, int maxMemoryMb, boolean highPriority) {}
