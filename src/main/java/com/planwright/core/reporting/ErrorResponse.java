package com.planwright.core.reporting;

/**
 * Caller-facing error envelope.
 */
public record ErrorResponse(
    boolean success,
    Detail error
) {

    public record Detail(String id, String message, String context, String code) {}

    public static ErrorResponse of(String id, String message, String context, String code) {
        return new ErrorResponse(false, new Detail(id, message, context, code));
    }
}
