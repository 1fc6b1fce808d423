package com.ailab.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every event to the {@code ailab.audit} logger, one line per event.
 * Access denials are logged at WARN, corruption at ERROR, everything else at INFO.
 */
@Component
public class AuditTrail {

    private static final Logger audit = LoggerFactory.getLogger("ailab.audit");

    private final EventBus eventBus;
    private EventBus.Subscription subscription;

    public AuditTrail(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribe(this::record);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void record(EnvironmentEvent event) {
        switch (event.eventType()) {
            case EnvironmentEvent.ACCESS_DENIED, EnvironmentEvent.CONFLICT_QUARANTINED ->
                    audit.warn("{} env={} owner={} {}", event.eventType(), event.envId(), event.ownerId(), event.payload());
            case EnvironmentEvent.LEDGER_CORRUPTION ->
                    audit.error("{} env={} owner={} {}", event.eventType(), event.envId(), event.ownerId(), event.payload());
            default ->
                    audit.info("{} env={} owner={} {}", event.eventType(), event.envId(), event.ownerId(), event.payload());
        }
    }
}
