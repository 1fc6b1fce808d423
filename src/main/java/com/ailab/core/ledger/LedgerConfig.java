package com.ailab.core.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LedgerStore ledgerStore(LedgerProperties properties, Clock clock) {
        String store = properties.getStore() == null ? "file" : properties.getStore().toLowerCase();
        return switch (store) {
            case "memory" -> {
                log.warn("Using in-memory ledger store; allocations will not survive a restart");
                yield new InMemoryLedgerStore();
            }
            case "file" -> new JsonFileLedgerStore(Path.of(properties.getPath()), properties.getMaxBackups(), clock);
            default -> throw new IllegalStateException("Unknown ledger store '" + properties.getStore()
                    + "'. Supported: file, memory");
        };
    }

    @Bean
    public AllocationLedger allocationLedger(LedgerStore ledgerStore, Clock clock) {
        return new AllocationLedger(ledgerStore, clock);
    }
}
