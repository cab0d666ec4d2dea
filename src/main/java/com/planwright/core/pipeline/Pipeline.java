package com.planwright.core.pipeline;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable list of stages.
 * <p>
 * Construction fails when two stages share a name or an output slot.
 * The {@code resultSlot} names the value returned as the plan on success and
 * {@code verificationSlot} the optional verification report.
 */
public final class Pipeline {

    private final List<StageDefinition<?>> stages;
    private final String seedSlot;
    private final String resultSlot;
    private final String verificationSlot;

    public Pipeline(List<StageDefinition<?>> stages, String seedSlot, String resultSlot, String verificationSlot) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        Set<String> names = new HashSet<>();
        Set<String> slots = new HashSet<>();
        slots.add(seedSlot);
        for (StageDefinition<?> stage : stages) {
            if (!names.add(stage.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
            if (!slots.add(stage.outputSlot())) {
                throw new IllegalArgumentException("Duplicate output slot: " + stage.outputSlot());
            }
        }
        this.stages = List.copyOf(stages);
        this.seedSlot = seedSlot;
        this.resultSlot = resultSlot;
        this.verificationSlot = verificationSlot;
    }

    public List<StageDefinition<?>> stages() {
        return stages;
    }

    public StageDefinition<?> stage(int index) {
        return stages.get(index);
    }

    public int size() {
        return stages.size();
    }

    /**
     * Position of the named stage, or -1 when no stage has that name.
     */
    public int indexOf(String stageName) {
        if (stageName == null) {
            return -1;
        }
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).name().equals(stageName)) {
                return i;
            }
        }
        return -1;
    }

    public String seedSlot() {
        return seedSlot;
    }

    public String resultSlot() {
        return resultSlot;
    }

    public String verificationSlot() {
        return verificationSlot;
    }
}
