package com.ailab.runtime;

import com.ailab.core.error.ErrorCode;

/**
 * A runtime call exceeded its bounded wait. Not retried: the environment is failed instead.
 */
public class RuntimeTimeoutException extends RuntimeUnavailableException {

    public RuntimeTimeoutException(String message) {
        super(ErrorCode.RUNTIME_TIMEOUT, message, null);
    }
}
