package com.ailab.core.error;

public class PortsExhaustedException extends EnvironmentException {

    public PortsExhaustedException(String message) {
        super(ErrorCode.PORTS_EXHAUSTED, null, message);
    }
}
