package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.model.ColorHints;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.ImageStyle;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.service.provider.OpenRouterClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GenerationPromptBuilderTest {

    private OpenRouterClient openRouter;
    private GenerationPromptBuilder builder;

    private final ExtractedIntent intent = new ExtractedIntent(false, List.of(), List.of("teamwork"),
            List.of("minimal"), List.of("diagram", "text"), Map.of());

    @BeforeEach
    void setUp() {
        openRouter = mock(OpenRouterClient.class);
        builder = new GenerationPromptBuilder(openRouter, JsonMapper.builder().build(), "prompt-model",
                Duration.ofSeconds(2));
    }

    private static SlideInput slide(String style, ColorHints colors) {
        return new SlideInput("Trabajo en equipo", null, null, style, null, null, colors);
    }

    @Test
    void knownScenarioAppendsStyleBlockAndColours() {
        when(openRouter.complete(eq("prompt-model"), eq(ScenarioPrompts.CONTENT_PROMPT), anyString(), any()))
                .thenReturn("Two people assembling a puzzle.");

        GenerationPromptBuilder.Prompt prompt = builder.build(
                slide("flat_illustration", new ColorHints("#003366", null)), intent, "teamwork, puzzle");

        assertTrue(prompt.positive().startsWith("Two people assembling a puzzle."));
        assertTrue(prompt.positive().contains(ScenarioPrompts.styleBlock(ImageStyle.FLAT_ILLUSTRATION)));
        assertTrue(prompt.positive().contains("primary colour #003366"));
        assertTrue(prompt.positive().endsWith(ScenarioPrompts.NO_TEXT));
        assertEquals("diagram, text, watermark, logo", prompt.negative());

        ArgumentCaptor<String> slideJson = ArgumentCaptor.forClass(String.class);
        verify(openRouter).complete(anyString(), anyString(), slideJson.capture(), any());
        assertTrue(slideJson.getValue().contains("\"title\":\"Trabajo en equipo\""));
        assertTrue(slideJson.getValue().contains("\"keywords\":\"teamwork, puzzle\""));
    }

    @Test
    void freeStyleUsesGenericPromptWithStyleAndColours() {
        when(openRouter.complete(anyString(), anyString(), eq("Keywords: teamwork"), any()))
                .thenReturn("A calm office team at a whiteboard.");

        GenerationPromptBuilder.Prompt prompt = builder.build(
                slide("corporate", new ColorHints("navy", "orange")), intent, "teamwork");

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(openRouter).complete(anyString(), system.capture(), anyString(), any());
        assertTrue(system.getValue().contains("Style requirements: corporate, minimal"));
        assertTrue(system.getValue().contains("primary colour navy, secondary colour orange"));
        assertEquals("A calm office team at a whiteboard. " + ScenarioPrompts.NO_TEXT, prompt.positive());
    }

    @Test
    void emptyLlmAnswerFails() {
        when(openRouter.complete(anyString(), anyString(), anyString(), any())).thenReturn(" ");

        assertThrows(IllegalStateException.class, () -> builder.build(slide(null, null), intent, "teamwork"));
    }

    @Test
    void colourInstructionIsEmptyWithoutColours() {
        assertEquals("", GenerationPromptBuilder.colorInstruction(null));
        assertEquals("", GenerationPromptBuilder.colorInstruction(new ColorHints(" ", null)));
        assertEquals("Colour requirements: secondary colour red.",
                GenerationPromptBuilder.colorInstruction(new ColorHints(null, "red")));
    }
}
