package com.planwright.core.pipeline;

/**
 * A stage rejected its input or produced unusable output. Never retried.
 */
public class StageException extends RuntimeException {

    private final String stage;

    public StageException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
