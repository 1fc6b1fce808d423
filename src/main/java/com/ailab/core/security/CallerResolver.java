package com.ailab.core.security;

import com.ailab.core.error.AccessDeniedException;
import com.ailab.core.model.Caller;
import org.springframework.stereotype.Component;

/**
 * Turns the user id the reverse proxy authenticated into a {@link Caller}.
 */
@Component
public class CallerResolver {

    private final SecurityProperties properties;

    public CallerResolver(SecurityProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws AccessDeniedException if no user id was supplied
     */
    public Caller resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new AccessDeniedException("No authenticated user on request");
        }
        String id = userId.trim();
        return new Caller(id, properties.getAdmins().contains(id));
    }

    public boolean isAdmin(String userId) {
        return userId != null && properties.getAdmins().contains(userId.trim());
    }
}
