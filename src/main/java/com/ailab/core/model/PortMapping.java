package com.ailab.core.model;

/**
 * A published port: {@code containerPort} inside the environment, {@code hostPort} on the node.
 * Host ports are unique cluster-wide while the owning environment is active.
 */
public record PortMapping(int containerPort, int hostPort) {}
