package com.planwright.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectRunRegistryTest {

    private final ProjectRunRegistry registry = new ProjectRunRegistry();

    @Test
    @DisplayName("only one run per project at a time")
    void exclusive() {
        var handle = registry.tryAcquire("p1").orElseThrow();
        assertTrue(registry.tryAcquire("p1").isEmpty());
        assertTrue(registry.tryAcquire("p2").isPresent());
        assertTrue(registry.isRunning("p1"));
        assertTrue(registry.isRunning("p2"));

        registry.release(handle);
        assertFalse(registry.isRunning("p1"));
        assertTrue(registry.tryAcquire("p1").isPresent());
    }

    @Test
    @DisplayName("cancel flags the active run only")
    void cancel() {
        var handle = registry.tryAcquire("p1").orElseThrow();
        assertFalse(handle.isCancelRequested());
        assertTrue(registry.cancel("p1"));
        assertTrue(handle.isCancelRequested());
        assertFalse(registry.cancel("unknown"));
    }

    @Test
    @DisplayName("releasing a stale handle keeps the newer run")
    void staleRelease() {
        var first = registry.tryAcquire("p1").orElseThrow();
        registry.release(first);
        registry.tryAcquire("p1").orElseThrow();
        registry.release(first);
        assertTrue(registry.isRunning("p1"));
    }
}
