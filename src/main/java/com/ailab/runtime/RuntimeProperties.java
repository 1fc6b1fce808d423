package com.ailab.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ailab")
public class RuntimeProperties {

    private Runtime runtime = new Runtime();

    // -- Runtime accessors (delegate to nested) --
    public String getProvider() { return runtime.provider; }
    public String getNamePrefix() { return runtime.namePrefix; }
    public String getDockerHost() { return runtime.dockerHost; }
    public String getGpuDriver() { return runtime.gpuDriver; }
    public Duration getCallTimeout() { return runtime.callTimeout; }
    public Duration getStopTimeout() { return runtime.stopTimeout; }
    public int getRetryAttempts() { return runtime.retry.maxAttempts; }
    public Duration getRetryInitialBackoff() { return runtime.retry.initialBackoff; }
    public double getRetryMultiplier() { return runtime.retry.multiplier; }
    public Duration getRetryMaxBackoff() { return runtime.retry.maxBackoff; }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }

    public static class Runtime {
        private String provider = "docker";
        private String namePrefix = "ai-lab-env-";
        private String dockerHost = "";
        private String gpuDriver = "nvidia";
        private Duration callTimeout = Duration.ofSeconds(60);
        private Duration stopTimeout = Duration.ofSeconds(30);
        private Retry retry = new Retry();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public String getGpuDriver() { return gpuDriver; }
        public void setGpuDriver(String gpuDriver) { this.gpuDriver = gpuDriver; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
        public Duration getStopTimeout() { return stopTimeout; }
        public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
    }

    /**
     * Bounded exponential backoff applied to transient runtime failures.
     */
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }
}
