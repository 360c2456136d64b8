package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.model.ImageStyle;

/**
 * Bloques de prompt por escenario de estilo.
 */
final class ScenarioPrompts {

    /** Convierte el JSON de la diapositiva en una descripción de contenido sin estilo. */
    static final String CONTENT_PROMPT = """
            You are an assistant that converts slide JSON into a concise English "content prompt" for an image generation model.

            Goal:
            From the JSON description of a lecture slide, create a short textual description of what should be visible in an illustration that supports the main idea of the slide. This text will later be combined with separate style, layout and negative prompt blocks.

            Your task:
            1. Understand the core concept of the slide from "title", "body_blocks" and "keywords".
            2. Choose a simple, didactic visual interpretation: a small scene with 1-3 people or key objects, a simple process with a few steps, or an abstract metaphor.
            3. Write 1-3 English sentences describing only the semantic content: who or what is visible and what they are doing.

            Important constraints:
            - Output plain English prose only. No JSON, lists or explanations.
            - Do not mention any visual style or medium (flat, vector, line art, photorealistic, 3D, watercolor...).
            - Do not mention colours, lighting, aspect ratio, resolution or composition.
            - Do not include negative instructions such as "no text" or "no logo".
            - Always write in English, even if the input is in German.
            """;

    /** Prompt genérico cuando el estilo no es un escenario conocido. */
    static final String GENERIC_PROMPT = """
            Based on the keywords, style and optional colours, write a single sentence prompt to generate a matching image.

            The image must be suitable for a PowerPoint slide, so no pictures that only fit a private context.

            %s
            %s

            Answer with exactly one sentence.
            """;

    static final String NO_TEXT = "No text, letters or numbers in the image.";

    private ScenarioPrompts() {
    }

    /** Bloque de estilo que se añade a la descripción de contenido. */
    static String styleBlock(ImageStyle style) {
        return switch (style) {
            case FLAT_ILLUSTRATION -> "Flat vector illustration, clean geometric shapes, limited palette, "
                    + "plain light background, generous whitespace, 16:9 slide composition.";
            case FINE_LINE -> "Minimal fine line drawing, thin continuous monochrome strokes, "
                    + "plain white background, lots of negative space.";
            case PHOTOREALISTIC -> "Photorealistic photograph, natural lighting, shallow depth of field, "
                    + "professional stock photo look.";
        };
    }
}
