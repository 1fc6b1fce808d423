package com.ailab.core.reconcile;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a reconciliation pass at startup and then at a fixed delay. Disabled for one-shot
 * CLI commands through {@code ailab.reconciler.schedule-enabled}.
 */
@Component
public class ReconcilerScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerScheduler.class);

    private final Reconciler reconciler;
    private final ReconcilerProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "reconciler");
        t.setDaemon(true);
        return t;
    });

    public ReconcilerScheduler(Reconciler reconciler, ReconcilerProperties properties) {
        this.reconciler = reconciler;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        if (!properties.isScheduleEnabled()) {
            log.debug("Scheduled reconciliation disabled");
            return;
        }
        long intervalMs = properties.getInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runScheduledPass, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Reconciler scheduled (interval={}s)", properties.getInterval().toSeconds());
    }

    @PreDestroy
    void stop() {
        scheduler.shutdownNow();
    }

    void runScheduledPass() {
        try {
            reconciler.reconcile();
        } catch (RuntimeException e) {
            // An exception here would cancel all future runs
            log.error("Scheduled reconciliation failed, retrying in {}s: {}",
                    properties.getInterval().toSeconds(), e.getMessage(), e);
        }
    }
}
