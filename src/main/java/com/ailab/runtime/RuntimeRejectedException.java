package com.ailab.runtime;

import com.ailab.core.error.EnvironmentException;
import com.ailab.core.error.ErrorCode;

/**
 * Permanent runtime failure (bad image, conflicting name, invalid device request).
 */
public class RuntimeRejectedException extends EnvironmentException {

    public RuntimeRejectedException(String message, Throwable cause) {
        super(ErrorCode.RUNTIME_REJECTED, null, message, cause);
    }
}
