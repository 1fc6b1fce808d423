package com.ailab.core.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ailab.ledger")
public class LedgerProperties {

    /** {@code file} or {@code memory}. */
    private String store = "file";
    private String path = "./data/resource_tracking.json";
    private int maxBackups = 20;

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public int getMaxBackups() { return maxBackups; }
    public void setMaxBackups(int maxBackups) { this.maxBackups = maxBackups; }
}
