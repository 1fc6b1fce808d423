package com.ailab.core.quota;

import com.ailab.core.model.QuotaTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ailab.quota")
public class QuotaProperties {

    private Map<QuotaTier, Tier> tiers = defaultTiers();
    private Map<String, QuotaTier> userTiers = new LinkedHashMap<>();

    public Map<QuotaTier, Tier> getTiers() { return tiers; }
    public void setTiers(Map<QuotaTier, Tier> tiers) { this.tiers = tiers; }
    public Map<String, QuotaTier> getUserTiers() { return userTiers; }
    public void setUserTiers(Map<String, QuotaTier> userTiers) { this.userTiers = userTiers; }

    public static class Tier {
        private int maxEnvironments;
        private int maxGpus;
        private int maxMemoryMb;
        private boolean highPriority;

        public Tier() {}

        public Tier(int maxEnvironments, int maxGpus, int maxMemoryMb, boolean highPriority) {
            this.maxEnvironments = maxEnvironments;
            this.maxGpus = maxGpus;
            this.maxMemoryMb = maxMemoryMb;
            this.highPriority = highPriority;
        }

        public int getMaxEnvironments() { return maxEnvironments; }
        public void setMaxEnvironments(int maxEnvironments) { this.maxEnvironments = maxEnvironments; }
        public int getMaxGpus() { return maxGpus; }
        public void setMaxGpus(int maxGpus) { this.maxGpus = maxGpus; }
        public int getMaxMemoryMb() { return maxMemoryMb; }
        public void setMaxMemoryMb(int maxMemoryMb) { this.maxMemoryMb = maxMemoryMb; }
        public boolean isHighPriority() { return highPriority; }
        public void setHighPriority(boolean highPriority) { this.highPriority = highPriority; }

        QuotaPolicy toPolicy() {
            return new QuotaPolicy(maxEnvironments, maxGpus, maxMemoryMb, highPriority);
        }
    }

    static Map<QuotaTier, Tier> defaultTiers() {
        var tiers = new EnumMap<QuotaTier, Tier>(QuotaTier.class);
        tiers.put(QuotaTier.DEFAULT, new Tier(3, 2, 32768, false));
        tiers.put(QuotaTier.PREMIUM, new Tier(5, 4, 65536, false));
        tiers.put(QuotaTier.ENTERPRISE, new Tier(10, 8, 131072, true));
        return tiers;
    }
}
