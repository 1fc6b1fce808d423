package com.ailab.core.reconcile;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ailab.reconciler")
public class ReconcilerProperties {

    private boolean scheduleEnabled = true;
    private Duration interval = Duration.ofSeconds(60);
    /** Owner given to adopted containers whose owner label is not trusted. */
    private String defaultOwner = "unowned";
    /** Take the owner of a managed orphan from its {@code ai-lab.owner} label. */
    private boolean trustOwnerLabels = false;

    public boolean isScheduleEnabled() { return scheduleEnabled; }
    public void setScheduleEnabled(boolean scheduleEnabled) { this.scheduleEnabled = scheduleEnabled; }
    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
    public String getDefaultOwner() { return defaultOwner; }
    public void setDefaultOwner(String defaultOwner) { this.defaultOwner = defaultOwner; }
    public boolean isTrustOwnerLabels() { return trustOwnerLabels; }
    public void setTrustOwnerLabels(boolean trustOwnerLabels) { this.trustOwnerLabels = trustOwnerLabels; }
}
