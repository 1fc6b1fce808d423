package com.ailab.core.error;

/**
 * Base of the environment manager's typed error taxonomy.
 *
 * <p>{@link #code()} is the stable, machine-readable category; {@link #reason()} an optional
 * finer-grained code (for example {@code gpu_quota_exceeded}); the message is for humans and logs.
 */
public class EnvironmentException extends RuntimeException {

    private final ErrorCode code;
    private final String reason;

    public EnvironmentException(ErrorCode code, String reason, String message) {
        super(message);
        this.code = code;
        this.reason = reason;
    }

    public EnvironmentException(ErrorCode code, String reason, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.reason = reason;
    }

    public ErrorCode code() {
        return code;
    }

    /** Finer-grained reason code; falls back to the category code. */
    public String reason() {
        return reason != null ? reason : code.code();
    }
}
