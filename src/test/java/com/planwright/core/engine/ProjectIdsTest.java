package com.planwright.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectIdsTest {

    @Test
    @DisplayName("ids are proj_ plus ten hex characters")
    void shape() {
        assertTrue(ProjectIds.generate("Atlas", 1_700_000_000_000L).matches("proj_[0-9a-f]{10}"));
    }

    @Test
    @DisplayName("the same name and time give the same id")
    void deterministic() {
        assertEquals(ProjectIds.generate("Atlas", 42L), ProjectIds.generate("Atlas", 42L));
        assertNotEquals(ProjectIds.generate("Atlas", 42L), ProjectIds.generate("Atlas", 43L));
    }

    @Test
    @DisplayName("a missing name still yields an id")
    void nullName() {
        assertTrue(ProjectIds.generate(null, 1L).startsWith("proj_"));
    }

    @Test
    @DisplayName("only single path segments of safe characters are valid ids")
    void validity() {
        assertTrue(ProjectIds.isValid(ProjectIds.generate("Atlas", 1L)));
        assertTrue(ProjectIds.isValid("atlas-1.v2_b"));
        assertFalse(ProjectIds.isValid("atlas/1"));
        assertFalse(ProjectIds.isValid("Atlas Inventory"));
        assertFalse(ProjectIds.isValid(".."));
        assertFalse(ProjectIds.isValid(""));
        assertFalse(ProjectIds.isValid(null));
    }
}
