package com.ailab.core.quota;

import com.ailab.core.ledger.AllocationLedger;
import com.ailab.core.model.Environment;
import com.ailab.core.model.QuotaTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates per-tier limits against what a user already holds in the ledger.
 *
 * <p>Stateless: usage is summed from the user's non-terminal environments on every call,
 * so the engine cannot drift from the ledger. Callers that act on the decision run the
 * check inside the ledger's write transaction.
 */
@Service
public class QuotaEngine {

    private static final Logger log = LoggerFactory.getLogger(QuotaEngine.class);

    private final AllocationLedger ledger;
    private final QuotaProperties properties;

    public QuotaEngine(AllocationLedger ledger, QuotaProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    /**
     * Checks GPUs first, then environment count, then memory; the first failing check
     * determines the reason.
     */
    public QuotaDecision canAllocate(String userId, int requestedGpus, int requestedMemoryMb) {
        UserUsage usage = usage(userId);
        QuotaPolicy policy = usage.policy();

        if (usage.gpus() + requestedGpus > policy.maxGpus()) {
            return deny(QuotaDenialReason.GPU_QUOTA_EXCEEDED, usage,
                    "GPU quota exceeded: holding " + usage.gpus() + ", requested " + requestedGpus
                            + ", limit " + policy.maxGpus() + " for tier " + tierName(usage.tier()));
        }
        if (usage.environments() + 1 > policy.maxEnvironments()) {
            return deny(QuotaDenialReason.ENV_COUNT_EXCEEDED, usage,
                    "Environment limit reached: " + usage.environments() + " of " + policy.maxEnvironments()
                            + " for tier " + tierName(usage.tier()));
        }
        if (usage.memoryMb() + requestedMemoryMb > policy.maxMemoryMb()) {
            return deny(QuotaDenialReason.MEMORY_QUOTA_EXCEEDED, usage,
                    "Memory quota exceeded: holding " + usage.memoryMb() + " MB, requested " + requestedMemoryMb
                            + " MB, limit " + policy.maxMemoryMb() + " MB for tier " + tierName(usage.tier()));
        }
        return QuotaDecision.allow(usage);
    }

    public UserUsage usage(String userId) {
        QuotaTier tier = tierOf(userId);
        List<Environment> held = ledger.listByOwner(userId).stream()
                .filter(Environment::holdsResources)
                .toList();
        int gpus = held.stream().mapToInt(Environment::gpuCount).sum();
        int memory = held.stream()
                .mapToInt(e -> e.resourceLimits() != null ? e.resourceLimits().memoryMb() : 0)
                .sum();
        return new UserUsage(userId, tier, held.size(), gpus, memory, policyFor(tier));
    }

    public QuotaTier tierOf(String userId) {
        return properties.getUserTiers().getOrDefault(userId, QuotaTier.DEFAULT);
    }

    public QuotaPolicy policyFor(QuotaTier tier) {
        QuotaProperties.Tier configured = properties.getTiers().get(tier);
        if (configured == null) {
            configured = QuotaProperties.defaultTiers().get(tier);
        }
        return configured.toPolicy();
    }

    private QuotaDecision deny(QuotaDenialReason reason, UserUsage usage, String message) {
        log.info("Quota denied for {}: {}", usage.userId(), message);
        return QuotaDecision.deny(reason, message, usage);
    }

    private static String tierName(QuotaTier tier) {
        return tier.name().toLowerCase();
    }
}
