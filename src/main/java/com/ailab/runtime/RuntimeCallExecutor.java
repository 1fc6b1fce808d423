package com.ailab.runtime;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs runtime adapter calls with a bounded wait and bounded exponential backoff.
 *
 * <p>Only {@link RuntimeUnavailableException} is retried. A {@link RuntimeTimeoutException}
 * is final: the caller fails the environment rather than waiting again.
 */
public class RuntimeCallExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuntimeCallExecutor.class);

    private final Retry retry;
    private final Duration callTimeout;
    private final ExecutorService executor;

    public RuntimeCallExecutor(RuntimeProperties properties) {
        this(properties.getRetryAttempts(), properties.getRetryInitialBackoff(),
                properties.getRetryMultiplier(), properties.getRetryMaxBackoff(), properties.getCallTimeout());
    }

    public RuntimeCallExecutor(int maxAttempts, Duration initialBackoff, double multiplier,
                               Duration maxBackoff, Duration callTimeout) {
        var config = RetryConfig.<Object>custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        initialBackoff.toMillis(), multiplier, maxBackoff.toMillis()))
                .retryOnException(e -> e instanceof RuntimeUnavailableException
                        && !(e instanceof RuntimeTimeoutException))
                .build();
        this.retry = Retry.of("runtime-adapter", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Runtime call failed (attempt {}), retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        this.callTimeout = callTimeout;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runtime-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Executes {@code action}, retrying transient failures.
     *
     * @param operation short name used in logs and timeout messages
     * @param target    environment id or container handle the call concerns
     */
    public <T> T call(String operation, String target, Supplier<T> action) {
        return retry.executeSupplier(() -> withTimeout(operation, target, action));
    }

    public void run(String operation, String target, Runnable action) {
        call(operation, target, () -> {
            action.run();
            return null;
        });
    }

    private <T> T withTimeout(String operation, String target, Supplier<T> action) {
        Future<T> future = executor.submit(action::get);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RuntimeTimeoutException("Runtime " + operation + " for " + target
                    + " did not complete within " + callTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeUnavailableException("Runtime " + operation + " for " + target + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RuntimeUnavailableException("Interrupted during runtime " + operation + " for " + target, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
