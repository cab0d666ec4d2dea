package com.planwright.core.llm;

/**
 * Port to a text-generation model.
 */
public interface TextGenerator {

    /**
     * @return the generated text, never blank
     * @throws TextGenerationException when the call fails or returns nothing
     */
    String generate(String systemPrompt, String userPrompt, GenerationOptions options);
}
