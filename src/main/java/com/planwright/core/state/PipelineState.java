package com.planwright.core.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable aggregate carried through one pipeline run.
 * <p>
 * Stage outputs are held as Jackson trees keyed by slot name and decoded on
 * read, so a stage always receives a fresh copy of an earlier stage's output
 * and a snapshot taken for a checkpoint is independent of later changes.
 */
public class PipelineState {

    private String projectId;
    private PipelineStatus status = PipelineStatus.NOT_STARTED;
    private Map<String, JsonNode> values = new LinkedHashMap<>();
    private List<ErrorLogEntry> errorLog = new ArrayList<>();
    private ProcessingMetadata metadata = new ProcessingMetadata();

    public PipelineState() {
    }

    public PipelineState(String projectId) {
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public void setStatus(PipelineStatus status) {
        this.status = status;
    }

    public Map<String, JsonNode> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public void setValues(Map<String, JsonNode> values) {
        this.values = values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
    }

    public List<ErrorLogEntry> getErrorLog() {
        return Collections.unmodifiableList(errorLog);
    }

    public void setErrorLog(List<ErrorLogEntry> errorLog) {
        this.errorLog = errorLog == null ? new ArrayList<>() : new ArrayList<>(errorLog);
    }

    public ProcessingMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(ProcessingMetadata metadata) {
        this.metadata = metadata == null ? new ProcessingMetadata() : metadata;
    }

    public void addError(ErrorLogEntry entry) {
        errorLog.add(entry);
    }

    public boolean hasValue(String slot) {
        JsonNode node = values.get(slot);
        return node != null && !node.isNull();
    }

    /**
     * Stores {@code value} under {@code slot}, replacing any previous value.
     */
    public void putValue(String slot, Object value) {
        values.put(slot, value == null ? null : PlanJson.mapper().valueToTree(value));
    }

    public <T> Optional<T> value(String slot, Class<T> type) {
        if (!hasValue(slot)) {
            return Optional.empty();
        }
        return Optional.of(decode(slot, mapper -> mapper.treeToValue(values.get(slot), type)));
    }

    public <T> Optional<T> value(String slot, TypeReference<T> type) {
        if (!hasValue(slot)) {
            return Optional.empty();
        }
        return Optional.of(decode(slot, m -> m.readValue(m.treeAsTokens(values.get(slot)), type)));
    }

    public JsonNode rawValue(String slot) {
        JsonNode node = values.get(slot);
        return node == null ? null : node.deepCopy();
    }

    /**
     * Deep copy through the JSON representation.
     */
    public PipelineState copy() {
        PipelineState copy = new PipelineState(projectId);
        copy.status = status;
        values.forEach((k, v) -> copy.values.put(k, v == null ? null : v.deepCopy()));
        copy.errorLog = new ArrayList<>(errorLog);
        copy.metadata = metadata.copy();
        return copy;
    }

    public void markStarted(Instant now) {
        status = PipelineStatus.PROCESSING;
        metadata.setStartTime(now);
        metadata.setEndTime(null);
    }

    public void markFinished(PipelineStatus finalStatus, Instant now) {
        status = finalStatus;
        metadata.setEndTime(now);
    }

    private <T> T decode(String slot, Decoder<T> decoder) {
        try {
            return decoder.decode(PlanJson.mapper());
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Cannot decode value of slot '" + slot + "': " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Decoder<T> {
        T decode(ObjectMapper mapper) throws java.io.IOException;
    }
}
