package com.ailab.core.events;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest {

    private final Logger auditLogger = (Logger) LoggerFactory.getLogger("ailab.audit");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private EventBus eventBus;
    private AuditTrail auditTrail;

    @BeforeEach
    void setUp() {
        appender.start();
        auditLogger.addAppender(appender);
        eventBus = new EventBus();
        auditTrail = new AuditTrail(eventBus);
        auditTrail.start();
    }

    @AfterEach
    void tearDown() {
        auditTrail.stop();
        auditLogger.detachAppender(appender);
    }

    private void publish(String type) {
        eventBus.publish(new EnvironmentEvent(type, "env-1", "alice", Map.of("op", "stop"), Instant.now()));
    }

    @Test
    void writesOneLinePerEvent() {
        publish(EnvironmentEvent.CREATED);
        publish(EnvironmentEvent.RUNNING);

        assertEquals(2, appender.list.size());
        String line = appender.list.get(0).getFormattedMessage();
        assertTrue(line.startsWith("environment.created env=env-1 owner=alice"));
        assertTrue(line.contains("op=stop"));
    }

    @Test
    void levelFollowsSeverity() {
        publish(EnvironmentEvent.ACCESS_DENIED);
        publish(EnvironmentEvent.LEDGER_CORRUPTION);
        publish(EnvironmentEvent.DESTROYED);

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals(Level.ERROR, appender.list.get(1).getLevel());
        assertEquals(Level.INFO, appender.list.get(2).getLevel());
    }

    @Test
    void stopUnsubscribes() {
        auditTrail.stop();
        publish(EnvironmentEvent.CREATED);

        assertTrue(appender.list.isEmpty());
    }
}
