package com.ailab.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeCallExecutorTest {

    private final RuntimeCallExecutor executor = new RuntimeCallExecutor(
            3, Duration.ofMillis(10), 2.0, Duration.ofMillis(50), Duration.ofMillis(500));

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("transient failures are retried until the call succeeds")
    void retriesUnavailable() {
        var attempts = new AtomicInteger();

        String result = executor.call("start", "env-1", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new RuntimeUnavailableException("daemon restarting", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("retries stop after the configured number of attempts")
    void givesUpAfterMaxAttempts() {
        var attempts = new AtomicInteger();

        assertThrows(RuntimeUnavailableException.class, () -> executor.run("stop", "env-1", () -> {
            attempts.incrementAndGet();
            throw new RuntimeUnavailableException("socket closed", null);
        }));
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("rejections are not retried")
    void rejectedIsFinal() {
        var attempts = new AtomicInteger();

        assertThrows(RuntimeRejectedException.class, () -> executor.run("create", "env-1", () -> {
            attempts.incrementAndGet();
            throw new RuntimeRejectedException("image not found", null);
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("a call that exceeds its bounded wait times out once and is not retried")
    void timeoutIsFinal() {
        var attempts = new AtomicInteger();

        var ex = assertThrows(RuntimeTimeoutException.class, () -> executor.run("start", "env-slow", () -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertEquals(1, attempts.get());
        assertTrue(ex.getMessage().contains("env-slow"));
    }

    @Test
    @DisplayName("a missing container is reported without retrying")
    void notFoundIsFinal() {
        var attempts = new AtomicInteger();

        assertThrows(ContainerNotFoundException.class, () -> executor.call("inspect", "c-9", () -> {
            attempts.incrementAndGet();
            throw new ContainerNotFoundException("c-9", null);
        }));
        assertEquals(1, attempts.get());
    }
}
