package com.planwright.core.persistence;

import java.io.Serializable;
import java.time.Instant;

/**
 * Metadata of a stored checkpoint; also the handle returned by a save.
 *
 * @param id        checkpoint id, unique within the project
 * @param projectId owning project
 * @param stageName stage after which the snapshot was taken, or "completed", "&lt;stage&gt;_failed", "&lt;stage&gt;_cancelled"
 * @param timestamp save time; strictly increasing per project
 * @param version   snapshot format version
 */
public record CheckpointInfo(
    String id,
    String projectId,
    String stageName,
    Instant timestamp,
    String version
) implements Serializable {}
