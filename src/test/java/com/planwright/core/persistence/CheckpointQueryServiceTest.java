package com.planwright.core.persistence;

import com.planwright.core.state.PipelineState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CheckpointQueryServiceTest {

    private final CheckpointStore store = mock(CheckpointStore.class);
    private final CheckpointQueryService service = new CheckpointQueryService(store);

    @Test
    @DisplayName("a project with a decodable latest state is resumable")
    void resumable() {
        when(store.loadLatestState("p1")).thenReturn(Optional.of(new PipelineState("p1")));
        assertTrue(service.hasResumableState("p1"));
    }

    @Test
    @DisplayName("missing or unreadable state is not resumable")
    void notResumable() {
        when(store.loadLatestState("none")).thenReturn(Optional.empty());
        when(store.loadLatestState("broken")).thenThrow(new CheckpointException("corrupt"));

        assertFalse(service.hasResumableState("none"));
        assertFalse(service.hasResumableState("broken"));
    }

    @Test
    @DisplayName("delegates listing to the store")
    void delegatesListing() {
        var info = new CheckpointInfo("c1", "p1", "projectInit", Instant.EPOCH, "1.0");
        when(store.listStates("p1")).thenReturn(List.of(info));
        when(store.listProjectIds()).thenReturn(List.of("p1", "p2"));

        assertEquals(List.of(info), service.listSavedStates("p1"));
        assertEquals(List.of("p1", "p2"), service.listAllProjectIds());
    }
}
