package com.planwright.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planwright.core.state.PlanJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Produces structured (typed) output from text-generation calls.
 * <p>
 * Uses {@link BeanOutputConverter} to derive a JSON schema from the target
 * Java class and append format instructions to the user prompt, then
 * deserializes the model's JSON reply into the requested type.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final TextGenerator textGenerator;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper;

    public LlmService(TextGenerator textGenerator, LlmProperties properties) {
        this.textGenerator = textGenerator;
        this.properties = properties;
        this.lenientMapper = PlanJson.newMapper()
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCall(systemPrompt, userPrompt, outputType, properties.defaultOptions());
    }

    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType, double temperature) {
        return structuredCall(systemPrompt, userPrompt, outputType,
                properties.defaultOptions().withTemperature(temperature));
    }

    /**
     * Sends a system + user prompt and returns the reply deserialized into {@code outputType}.
     *
     * @throws TextGenerationException when the call fails or the reply is empty
     * @throws LlmParseException       when the reply is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType,
                                GenerationOptions options) {
        log.info("LLM call started → {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = textGenerator.generate(systemPrompt, userPrompt + "\n\n" + converter.getFormat(), options);
        log.info("LLM call complete → {} ({}s)", outputType.getSimpleName(),
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new TextGenerationException(TextGenerationException.Kind.EMPTY_RESPONSE,
                    "LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.debug("Schema converter rejected response for {}: {}", outputType.getSimpleName(), e.getMessage());
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Fallback parsing: strips markdown fences and any prose around the outermost JSON value.
     */
    <T> T parseWithJackson(String raw, Class<T> outputType) {
        String cleaned = extractJson(raw);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", raw);
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String extractJson(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int objectStart = cleaned.indexOf('{');
        int objectEnd = cleaned.lastIndexOf('}');
        if (objectStart > 0 && objectEnd > objectStart) {
            cleaned = cleaned.substring(objectStart, objectEnd + 1);
        }
        return cleaned;
    }
}
