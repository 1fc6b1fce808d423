package com.ailab.core.error;

import com.ailab.core.model.EnvironmentStatus;

/**
 * Requested operation is not valid for the environment's current status.
 */
public class InvalidStateException extends EnvironmentException {

    public InvalidStateException(String envId, EnvironmentStatus current, String operation) {
        super(ErrorCode.INVALID_STATE, null,
                "Cannot " + operation + " environment " + envId + " in status " + current);
    }

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, null, message);
    }
}
