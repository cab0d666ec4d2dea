package com.planwright.core.retry;

import com.planwright.core.llm.TextGenerationException;
import com.planwright.core.pipeline.StageException;
import org.springframework.web.client.RestClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is transient (worth retrying) or fatal.
 * <p>
 * Rules are applied to each throwable of the cause chain in turn, first match wins:
 * stage errors are fatal; text-generation errors are judged by their kind; a derived
 * error code in the retryable set, or an HTTP status of 429 or 5xx, is transient.
 * When no rule matches, messages mentioning overload, rate limits, timeouts or
 * capacity are transient and everything else is fatal.
 */
public class ErrorClassifier {

    private static final List<String> TRANSIENT_KEYWORDS = List.of("overloaded", "rate limit", "timeout", "capacity");
    private static final int MAX_CHAIN_DEPTH = 16;

    public record Classification(boolean retryable, String code, String reason) {}

    public boolean isRetryable(Throwable error, Set<String> retryableCodes) {
        return classify(error, retryableCodes).retryable();
    }

    public Classification classify(Throwable error, Set<String> retryableCodes) {
        List<Throwable> chain = causeChain(error);
        for (Throwable t : chain) {
            if (t instanceof StageException) {
                return new Classification(false, "STAGE_ERROR", "stage rejected its input");
            }
            if (t instanceof TextGenerationException tge) {
                return switch (tge.getKind()) {
                    case MODEL_NOT_FOUND, MALFORMED_REQUEST ->
                            new Classification(false, tge.getKind().name(), "text generation request cannot succeed");
                    case TIMEOUT, SERVICE_UNAVAILABLE, NETWORK_ERROR, EMPTY_RESPONSE ->
                            new Classification(true, tge.getKind().name(), "transient text generation failure");
                };
            }
            String code = errorCode(t);
            if (code != null && retryableCodes.contains(code)) {
                return new Classification(true, code, "retryable error code");
            }
            Integer status = httpStatus(t);
            if (status != null && (status >= 500 || status == 429)) {
                return new Classification(true, status == 429 ? "RATE_LIMIT" : "SERVER_ERROR", "HTTP " + status);
            }
        }
        for (Throwable t : chain) {
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            for (String keyword : TRANSIENT_KEYWORDS) {
                if (lower.contains(keyword)) {
                    return new Classification(true, errorCode(error), "message mentions '" + keyword + "'");
                }
            }
        }
        return new Classification(false, errorCode(error), "not a transient failure");
    }

    /**
     * Network-level error code derived from the exception type or message, or {@code null}.
     */
    public static String errorCode(Throwable t) {
        if (t == null) {
            return null;
        }
        if (t instanceof TextGenerationException tge) {
            return tge.getKind().name();
        }
        if (t instanceof SocketTimeoutException) {
            return "ETIMEDOUT";
        }
        if (t instanceof ConnectException) {
            return "ECONNREFUSED";
        }
        if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
            return "TIMEOUT";
        }
        String message = t.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("connection reset")) {
            return "ECONNRESET";
        }
        return null;
    }

    private static Integer httpStatus(Throwable t) {
        if (t instanceof RestClientResponseException rce) {
            return rce.getStatusCode().value();
        }
        if (t instanceof TextGenerationException tge) {
            return tge.getStatusCode();
        }
        return null;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CHAIN_DEPTH && seen.put(current, Boolean.TRUE) == null) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
