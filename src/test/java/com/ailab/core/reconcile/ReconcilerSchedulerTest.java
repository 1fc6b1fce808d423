package com.ailab.core.reconcile;

import com.ailab.runtime.RuntimeUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReconcilerSchedulerTest {

    @Test
    void failedPassDoesNotPropagate() {
        var reconciler = mock(Reconciler.class);
        when(reconciler.reconcile()).thenThrow(new RuntimeUnavailableException("daemon down", null));
        var scheduler = new ReconcilerScheduler(reconciler, new ReconcilerProperties());

        assertDoesNotThrow(scheduler::runScheduledPass);
        verify(reconciler).reconcile();
    }

    @Test
    void disabledScheduleNeverRuns() throws InterruptedException {
        var reconciler = mock(Reconciler.class);
        var properties = new ReconcilerProperties();
        properties.setScheduleEnabled(false);
        var scheduler = new ReconcilerScheduler(reconciler, properties);

        scheduler.start();
        Thread.sleep(100);
        scheduler.stop();

        verifyNoInteractions(reconciler);
    }

    @Test
    void enabledScheduleRunsAtStartup() {
        var reconciler = mock(Reconciler.class);
        var properties = new ReconcilerProperties();
        properties.setInterval(Duration.ofMinutes(10));
        var scheduler = new ReconcilerScheduler(reconciler, properties);

        scheduler.start();
        try {
            verify(reconciler, timeout(2000)).reconcile();
        } finally {
            scheduler.stop();
        }
    }
}
