package com.planwright.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TextGenerator} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Each call runs on a helper thread so the configured deadline can be enforced
 * regardless of the underlying HTTP client's own timeouts. Spring AI and HTTP
 * failures are translated into {@link TextGenerationException} kinds.
 */
@Component
public class SpringAiTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerator.class);

    private final ChatClient chatClient;
    private final ExecutorService callExecutor;

    public SpringAiTextGenerator(ChatClient.Builder builder) {
        this.chatClient = builder.build();
        AtomicInteger counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, GenerationOptions options) {
        ChatOptions chatOptions = ChatOptions.builder()
                .temperature(options.temperature())
                .maxTokens(options.maxOutputTokens())
                .build();
        long start = System.currentTimeMillis();
        Future<String> future = callExecutor.submit(() -> chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(chatOptions)
                .call()
                .content());
        String content;
        try {
            content = future.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TextGenerationException(TextGenerationException.Kind.TIMEOUT,
                    "Text generation timed out after " + options.timeout().toSeconds() + "s", null, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TextGenerationException(TextGenerationException.Kind.SERVICE_UNAVAILABLE,
                    "Interrupted while waiting for text generation", null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error error) {
                throw error;
            }
            throw translate(cause);
        }
        log.debug("Text generation finished in {}ms", System.currentTimeMillis() - start);
        if (content == null || content.isBlank()) {
            throw new TextGenerationException(TextGenerationException.Kind.EMPTY_RESPONSE,
                    "Model returned empty content");
        }
        return content;
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    static RuntimeException translate(Throwable cause) {
        if (cause instanceof TextGenerationException tge) {
            return tge;
        }
        if (cause instanceof TransientAiException) {
            return new TextGenerationException(TextGenerationException.Kind.SERVICE_UNAVAILABLE,
                    cause.getMessage(), null, cause);
        }
        if (cause instanceof NonTransientAiException) {
            String message = cause.getMessage() == null ? "" : cause.getMessage();
            TextGenerationException.Kind kind = message.toLowerCase(Locale.ROOT).contains("not found")
                    ? TextGenerationException.Kind.MODEL_NOT_FOUND
                    : TextGenerationException.Kind.MALFORMED_REQUEST;
            return new TextGenerationException(kind, message, null, cause);
        }
        if (cause instanceof ResourceAccessException) {
            TextGenerationException.Kind kind = hasCause(cause, SocketTimeoutException.class)
                    ? TextGenerationException.Kind.TIMEOUT
                    : TextGenerationException.Kind.NETWORK_ERROR;
            return new TextGenerationException(kind, cause.getMessage(), null, cause);
        }
        if (cause instanceof RestClientResponseException rce) {
            int status = rce.getStatusCode().value();
            TextGenerationException.Kind kind;
            if (status == 404) {
                kind = TextGenerationException.Kind.MODEL_NOT_FOUND;
            } else if (status == 429 || status >= 500) {
                kind = TextGenerationException.Kind.SERVICE_UNAVAILABLE;
            } else {
                kind = TextGenerationException.Kind.MALFORMED_REQUEST;
            }
            return new TextGenerationException(kind, "HTTP " + status + ": " + rce.getMessage(), status, cause);
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new TextGenerationException(TextGenerationException.Kind.SERVICE_UNAVAILABLE,
                cause.getMessage(), null, cause);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
