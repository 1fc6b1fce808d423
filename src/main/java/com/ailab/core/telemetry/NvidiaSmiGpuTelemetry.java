package com.ailab.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads utilization from {@code nvidia-smi}. Every call runs the tool; nothing is cached.
 */
public class NvidiaSmiGpuTelemetry implements GpuTelemetry {

    private static final Logger log = LoggerFactory.getLogger(NvidiaSmiGpuTelemetry.class);

    static final List<String> QUERY_ARGS = List.of(
            "--query-gpu=index,memory.used,memory.total,utilization.gpu",
            "--format=csv,noheader,nounits");

    private final String executable;
    private final Duration timeout;

    public NvidiaSmiGpuTelemetry(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public List<GpuUtilization> utilization() {
        var command = new ArrayList<String>();
        command.add(executable);
        command.addAll(QUERY_ARGS);
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("nvidia-smi did not answer within {}s", timeout.toSeconds());
                return List.of();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                log.warn("nvidia-smi exited with {}: {}", process.exitValue(), output.strip());
                return List.of();
            }
            return parse(output);
        } catch (IOException e) {
            log.warn("nvidia-smi unavailable: {}", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while querying nvidia-smi");
            return List.of();
        }
    }

    /**
     * Parses {@code index, memory.used, memory.total, utilization.gpu} lines. Malformed lines
     * are skipped.
     */
    static List<GpuUtilization> parse(String output) {
        var gpus = new ArrayList<GpuUtilization>();
        for (String line : output.split("\\R")) {
            if (line.isBlank()) continue;
            String[] fields = line.split(",");
            if (fields.length < 4) {
                log.debug("Skipping nvidia-smi line: {}", line);
                continue;
            }
            try {
                gpus.add(new GpuUtilization(
                        Integer.parseInt(fields[0].trim()),
                        Integer.parseInt(fields[3].trim()),
                        Integer.parseInt(fields[1].trim()),
                        Integer.parseInt(fields[2].trim())));
            } catch (NumberFormatException e) {
                // "[N/A]" for GPUs that do not report a metric
                log.debug("Skipping nvidia-smi line with non-numeric field: {}", line);
            }
        }
        return gpus;
    }
}
