package com.ailab.core.security;

import com.ailab.core.error.AccessDeniedException;
import com.ailab.core.model.Caller;
import com.ailab.core.model.Environment;
import com.ailab.core.model.ResourceLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallerResolverTest {

    private CallerResolver resolver;

    @BeforeEach
    void setUp() {
        var properties = new SecurityProperties();
        properties.setAdmins(List.of("root-ops"));
        resolver = new CallerResolver(properties);
    }

    @Test
    void regularUser() {
        Caller caller = resolver.resolve(" alice ");

        assertEquals("alice", caller.userId());
        assertFalse(caller.admin());
    }

    @Test
    void configuredAdmin() {
        assertTrue(resolver.resolve("root-ops").admin());
        assertTrue(resolver.isAdmin("root-ops"));
        assertFalse(resolver.isAdmin(null));
    }

    @Test
    void missingUserIsDenied() {
        assertThrows(AccessDeniedException.class, () -> resolver.resolve(null));
        assertThrows(AccessDeniedException.class, () -> resolver.resolve("  "));
    }

    @Test
    void callersOnlyReachTheirOwnEnvironmentsUnlessAdmin() {
        Caller alice = resolver.resolve("alice");
        Caller admin = resolver.resolve("root-ops");

        var alicesEnv = Environment.requested("env-a", "alice", "vscode", List.of(), Set.of(),
                new ResourceLimits(2.0, 8192), Instant.parse("2026-03-01T09:00:00Z"));
        var bobsEnv = alicesEnv.withOwner("bob");

        assertTrue(alice.mayAccess(alicesEnv));
        assertFalse(alice.mayAccess(bobsEnv));
        assertTrue(admin.mayAccess(bobsEnv));
    }
}
