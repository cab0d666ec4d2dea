package com.planwright.core.state;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run bookkeeping carried inside {@link PipelineState}.
 */
public class ProcessingMetadata {

    private Instant startTime;
    private Instant endTime;
    private String lastStageCompleted;
    private int resumeCount;
    private Map<String, StageTiming> stageTimings = new LinkedHashMap<>();

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public String getLastStageCompleted() {
        return lastStageCompleted;
    }

    public void setLastStageCompleted(String lastStageCompleted) {
        this.lastStageCompleted = lastStageCompleted;
    }

    public int getResumeCount() {
        return resumeCount;
    }

    public void setResumeCount(int resumeCount) {
        this.resumeCount = resumeCount;
    }

    public Map<String, StageTiming> getStageTimings() {
        return stageTimings;
    }

    public void setStageTimings(Map<String, StageTiming> stageTimings) {
        this.stageTimings = stageTimings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stageTimings);
    }

    public void recordTiming(String stage, StageTiming timing) {
        stageTimings.put(stage, timing);
    }

    public ProcessingMetadata copy() {
        ProcessingMetadata copy = new ProcessingMetadata();
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.lastStageCompleted = lastStageCompleted;
        copy.resumeCount = resumeCount;
        copy.stageTimings = new LinkedHashMap<>(stageTimings);
        return copy;
    }
}
