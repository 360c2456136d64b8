package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.model.ColorHints;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.ImageStyle;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.service.provider.OpenRouterClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Construye el prompt de generación con una llamada al LLM.
 *
 * Escenario conocido: el LLM describe sólo el contenido y aquí se añade el bloque de estilo.
 * Estilo libre: el LLM escribe la frase completa con estilo y colores.
 * Los colores siempre acaban como texto del prompt; las keywords negativas van aparte.
 */
@Component
public class GenerationPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(GenerationPromptBuilder.class);

    static final List<String> DEFAULT_NEGATIVES = List.of("text", "watermark", "logo");

    private final OpenRouterClient openRouterClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration timeout;

    public GenerationPromptBuilder(OpenRouterClient openRouterClient,
            ObjectMapper objectMapper,
            @Value("${colecture.models.prompt}") String model,
            @Value("${colecture.timeouts.prompt}") Duration timeout) {
        this.openRouterClient = openRouterClient;
        this.objectMapper = objectMapper;
        this.model = model;
        this.timeout = timeout;
    }

    /**
     * @param slide    diapositiva original (título, viñetas, estilo, colores)
     * @param intent   intención extraída
     * @param keywords keywords refinadas
     * @return prompt positivo y negativo
     * @throws RuntimeException si el LLM falla o devuelve un prompt vacío
     */
    public Prompt build(SlideInput slide, ExtractedIntent intent, String keywords) {
        Optional<ImageStyle> scenario = ImageStyle.fromTag(slide.style());

        String content = scenario.isPresent()
                ? openRouterClient.complete(model, ScenarioPrompts.CONTENT_PROMPT, slideJson(slide, keywords), timeout)
                : openRouterClient.complete(model,
                        ScenarioPrompts.GENERIC_PROMPT.formatted(styleInstruction(slide, intent),
                                colorInstruction(slide.colors())),
                        "Keywords: " + keywords, timeout);

        if (content == null || content.isBlank()) {
            throw new IllegalStateException("El LLM devolvió un prompt vacío");
        }

        List<String> parts = new ArrayList<>();
        parts.add(content.strip());
        scenario.map(ScenarioPrompts::styleBlock).ifPresent(parts::add);
        String colors = colorInstruction(slide.colors());
        if (scenario.isPresent() && !colors.isEmpty()) {
            parts.add(colors);
        }
        parts.add(ScenarioPrompts.NO_TEXT);

        Prompt prompt = new Prompt(String.join(" ", parts), negativePrompt(intent));
        log.debug("Prompt de generación: {}", prompt.positive());
        return prompt;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String slideJson(SlideInput slide, String keywords) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("title", slide.title());
        json.put("body_blocks", slide.bullets().stream()
                .map(b -> Map.of("bullet", b.bullet() != null ? b.bullet() : "", "sub", b.sub()))
                .toList());
        json.put("keywords", keywords);
        return objectMapper.writeValueAsString(json);
    }

    private static String styleInstruction(SlideInput slide, ExtractedIntent intent) {
        Set<String> styles = new LinkedHashSet<>();
        if (slide.style() != null && !slide.style().isBlank()) {
            styles.add(slide.style().strip());
        }
        styles.addAll(intent.style());
        return styles.isEmpty() ? "" : "Style requirements: " + String.join(", ", styles);
    }

    static String colorInstruction(ColorHints colors) {
        if (colors == null || colors.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (colors.primary() != null && !colors.primary().isBlank()) {
            parts.add("primary colour " + colors.primary().strip());
        }
        if (colors.secondary() != null && !colors.secondary().isBlank()) {
            parts.add("secondary colour " + colors.secondary().strip());
        }
        return "Colour requirements: " + String.join(", ", parts) + ".";
    }

    static String negativePrompt(ExtractedIntent intent) {
        Set<String> negatives = new LinkedHashSet<>(intent.negativeKeywords());
        negatives.addAll(DEFAULT_NEGATIVES);
        return String.join(", ", negatives);
    }

    /**
     * @param positive prompt que describe la imagen
     * @param negative términos a evitar, separados por coma
     */
    public record Prompt(String positive, String negative) {
    }
}
