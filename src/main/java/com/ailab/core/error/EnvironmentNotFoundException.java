package com.ailab.core.error;

public class EnvironmentNotFoundException extends EnvironmentException {

    public EnvironmentNotFoundException(String envId) {
        super(ErrorCode.NOT_FOUND, null, "Environment not found: " + envId);
    }
}
