package com.ailab.core.error;

/**
 * Caller is neither the owner of the environment nor an admin.
 */
public class AccessDeniedException extends EnvironmentException {

    public AccessDeniedException(String message) {
        super(ErrorCode.ACCESS_DENIED, null, message);
    }
}
