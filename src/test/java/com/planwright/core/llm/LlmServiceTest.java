package com.planwright.core.llm;

import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.Risk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmServiceTest {

    private TextGenerator generator;
    private LlmService service;

    @BeforeEach
    void setUp() {
        generator = mock(TextGenerator.class);
        service = new LlmService(generator, new LlmProperties());
    }

    private void reply(String text) {
        when(generator.generate(anyString(), anyString(), any(GenerationOptions.class))).thenReturn(text);
    }

    @Nested
    @DisplayName("structuredCall")
    class StructuredCallTests {

        @Test
        void parsesJson() {
            reply("{\"description\":\"Scope creep\",\"impact\":\"High\",\"mitigation\":\"Freeze scope\"}");

            Risk risk = service.structuredCall("system", "user", Risk.class);

            assertEquals(new Risk("Scope creep", "High", "Freeze scope"), risk);
        }

        @Test
        @DisplayName("prose and code fences around the JSON are stripped")
        void fencedJson() {
            reply("Here is the risk:\n```json\n{\"description\":\"Vendor delay\",\"impact\":\"Medium\"}\n```");

            Risk risk = service.structuredCall("system", "user", Risk.class);

            assertEquals("Vendor delay", risk.description());
            assertNull(risk.mitigation());
        }

        @Test
        @DisplayName("a single value is accepted where a list is expected")
        void lenientLists() {
            reply("{\"summary\":\"Portal\",\"objectives\":\"Go live\"}");

            ProjectOverview overview = service.structuredCall("system", "user", ProjectOverview.class);

            assertEquals(List.of("Go live"), overview.objectives());
        }

        @Test
        void emptyReply() {
            reply("  ");

            TextGenerationException e = assertThrows(TextGenerationException.class,
                    () -> service.structuredCall("system", "user", Risk.class));
            assertEquals(TextGenerationException.Kind.EMPTY_RESPONSE, e.getKind());
        }

        @Test
        void unparseableReply() {
            reply("I cannot help with that.");

            assertThrows(LlmParseException.class, () -> service.structuredCall("system", "user", Risk.class));
        }

        @Test
        @DisplayName("format instructions are appended and the temperature is overridden")
        void passesOptions() {
            reply("{\"description\":\"x\"}");

            service.structuredCall("system", "Plan the project", Risk.class, 0.2);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
            verify(generator).generate(eq("system"), prompt.capture(), options.capture());
            assertTrue(prompt.getValue().startsWith("Plan the project\n\n"));
            assertTrue(prompt.getValue().length() > "Plan the project\n\n".length());
            assertEquals(0.2, options.getValue().temperature());
            assertEquals(4000, options.getValue().maxOutputTokens());
        }
    }

    @Test
    void extractJson() {
        assertEquals("{\"a\":1}", LlmService.extractJson("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.extractJson("```\n{\"a\":1}```"));
        assertEquals("{\"a\":{\"b\":2}}", LlmService.extractJson("Result: {\"a\":{\"b\":2}} done"));
        assertEquals("[1,2]", LlmService.extractJson(" [1,2] "));
    }
}
