package com.ailab.core.model;

import java.util.Objects;

/**
 * Identity on whose behalf an operation runs.
 */
public record Caller(String userId, boolean admin) {

    public Caller {
        Objects.requireNonNull(userId, "userId");
    }

    public static Caller user(String userId) {
        return new Caller(userId, false);
    }

    public static Caller admin(String userId) {
        return new Caller(userId, true);
    }

    public boolean mayAccess(Environment environment) {
        return admin || userId.equals(environment.ownerId());
    }
}
