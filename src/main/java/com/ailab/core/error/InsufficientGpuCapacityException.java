package com.ailab.core.error;

public class InsufficientGpuCapacityException extends EnvironmentException {

    public InsufficientGpuCapacityException(String message) {
        super(ErrorCode.INSUFFICIENT_GPU_CAPACITY, null, message);
    }
}
