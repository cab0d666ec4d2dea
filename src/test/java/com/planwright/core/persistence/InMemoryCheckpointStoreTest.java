package com.planwright.core.persistence;

import com.planwright.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCheckpointStoreTest {

    private InMemoryCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore(Clock.fixed(Instant.parse("2026-04-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("keeps every snapshot and returns the latest")
    void keepsHistory() {
        PipelineState state = new PipelineState("p1");
        state.putValue("x", Map.of("v", 1));
        store.saveState("p1", state, "one");
        state.putValue("x", Map.of("v", 2));
        store.saveState("p1", state, "two");

        assertEquals(2, store.loadLatestState("p1").orElseThrow().rawValue("x").get("v").asInt());
        List<CheckpointInfo> infos = store.listStates("p1");
        assertEquals(List.of("two", "one"), infos.stream().map(CheckpointInfo::stageName).toList());
        assertTrue(infos.get(0).timestamp().isAfter(infos.get(1).timestamp()));
    }

    @Test
    @DisplayName("snapshots are independent of the live state")
    void snapshotsAreCopies() {
        PipelineState state = new PipelineState("p1");
        state.putValue("x", Map.of("v", 1));
        CheckpointInfo info = store.saveState("p1", state, "one");
        state.putValue("x", Map.of("v", 7));

        assertEquals(1, store.load("p1", info.id()).orElseThrow().restoreState().rawValue("x").get("v").asInt());
    }

    @Test
    @DisplayName("rejects blank project ids")
    void rejectsBlankIds() {
        assertThrows(CheckpointException.class, () -> store.saveState(" ", new PipelineState(), "x"));
    }

    @Test
    @DisplayName("lists projects in order")
    void listsProjects() {
        store.saveState("b", new PipelineState("b"), "s");
        store.saveState("a", new PipelineState("a"), "s");
        assertEquals(List.of("a", "b"), store.listProjectIds());
        assertTrue(store.loadLatestState("c").isEmpty());
    }
}
