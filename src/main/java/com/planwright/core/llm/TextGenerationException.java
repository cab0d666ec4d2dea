package com.planwright.core.llm;

/**
 * Failure reported by a {@link TextGenerator}. The {@link Kind} tells the retry
 * layer whether the call is worth repeating.
 */
public class TextGenerationException extends RuntimeException {

    public enum Kind {
        NETWORK_ERROR,
        TIMEOUT,
        SERVICE_UNAVAILABLE,
        EMPTY_RESPONSE,
        MODEL_NOT_FOUND,
        MALFORMED_REQUEST
    }

    private final Kind kind;
    private final Integer statusCode;

    public TextGenerationException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public TextGenerationException(Kind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /** HTTP status of the failed call, when one was received. */
    public Integer getStatusCode() {
        return statusCode;
    }
}
