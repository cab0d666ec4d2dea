package com.planwright.core.pipeline;

import com.planwright.core.retry.RetryPolicy;
import com.planwright.core.state.PipelineState;

import java.util.Objects;
import java.util.function.Function;

/**
 * One step of a pipeline: reads its inputs from the state, produces one output slot.
 *
 * @param name          unique stage name, recorded as {@code lastStageCompleted}
 * @param outputSlot    unique state slot receiving the stage result
 * @param inputSelector pure function selecting the stage input from the state
 * @param invoker       the stage body
 * @param retryPolicy   backoff override for this stage, or {@code null} for the default
 * @param <I>           input type
 */
public record StageDefinition<I>(
    String name,
    String outputSlot,
    Function<PipelineState, I> inputSelector,
    Function<I, ?> invoker,
    RetryPolicy retryPolicy
) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outputSlot, "outputSlot");
        Objects.requireNonNull(inputSelector, "inputSelector");
        Objects.requireNonNull(invoker, "invoker");
    }

    public static <I> StageDefinition<I> of(String name, String outputSlot,
                                            Function<PipelineState, I> inputSelector,
                                            Function<I, ?> invoker) {
        return new StageDefinition<>(name, outputSlot, inputSelector, invoker, null);
    }

    public StageDefinition<I> withRetryPolicy(RetryPolicy policy) {
        return new StageDefinition<>(name, outputSlot, inputSelector, invoker, policy);
    }

    /**
     * Selects the input from {@code state} and runs the stage.
     *
     * @throws StageException when the stage yields no output
     */
    public Object invoke(PipelineState state) {
        Object output = invoker.apply(inputSelector.apply(state));
        if (output == null) {
            throw new StageException(name, "Stage " + name + " produced no output");
        }
        return output;
    }
}
