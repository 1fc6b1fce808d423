package com.ailab.runtime;

import com.ailab.core.error.EnvironmentException;
import com.ailab.core.error.ErrorCode;

/**
 * Transient runtime failure (daemon unreachable, socket error). Callers retry with backoff.
 */
public class RuntimeUnavailableException extends EnvironmentException {

    public RuntimeUnavailableException(String message, Throwable cause) {
        super(ErrorCode.RUNTIME_UNAVAILABLE, null, message, cause);
    }

    protected RuntimeUnavailableException(ErrorCode code, String message, Throwable cause) {
        super(code, null, message, cause);
    }
}
