package com.ailab.runtime;

import com.ailab.core.error.EnvironmentException;
import com.ailab.core.error.ErrorCode;

/**
 * The runtime has no record of the container (crashed host, manual removal).
 */
public class ContainerNotFoundException extends EnvironmentException {

    public ContainerNotFoundException(String handle, Throwable cause) {
        super(ErrorCode.NOT_FOUND, "container_not_found", "Container not found: " + handle, cause);
    }
}
