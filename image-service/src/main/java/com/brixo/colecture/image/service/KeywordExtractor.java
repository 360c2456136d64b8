package com.brixo.colecture.image.service;

import com.brixo.colecture.image.exception.ExtractionException;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.KeywordExtraction;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.service.provider.OpenRouterClient;
import com.brixo.colecture.image.support.IsolatedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;

/**
 * Convierte el texto de una diapositiva en una intención de búsqueda visual.
 *
 * Flujo de 2 llamadas al LLM:
 * 1. Extracción detallada en JSON (keywords EN, estilos, negativos, restricciones)
 * 2. Refinado a 2-3 keywords de búsqueda (tolerante a fallos)
 *
 * Si la petición trae keywords explícitas no se llama al LLM.
 */
@Service
public class KeywordExtractor {

    private static final Logger log = LoggerFactory.getLogger(KeywordExtractor.class);

    private static final int REFINED_KEYWORD_LIMIT = 3;

    static final String EXTRACTION_PROMPT = """
            You extract image-relevant stock photo keywords from presentation slide text.
            Rules:
            - No brands, names, confidential data, numbers or IDs without visual meaning.
            - Produce generic, visual terms in English (e.g. "teamwork", "data analytics").
            - Focus on subject, scene, object, mood and environment.
            - If the text is unusable (agenda, pure mix of numbers) return "skip": true and empty lists.
            Output ONLY valid JSON with these keys in this order:
            {
             "skip": boolean,
             "topics_de": string[],         // 3-6 short German topics
             "english_keywords": string[],  // 10-15 search optimised terms (EN, lower case)
             "style": string[],             // 2-4 (e.g. "minimal", "isometric", "aerial")
             "negative_keywords": string[], // 5-10 (e.g. "text","watermark","logo","diagram","screenshot")
             "constraints": { "orientation": "landscape"|"portrait"|"square", "color": string|null }
            }
            Make sure every array is free of duplicates and filler words.
            """;

    static final String REFINEMENT_PROMPT = """
            Pick the most important keywords and reduce them to 2-3 English search terms.

            Context: we are searching pictures for PowerPoint slides.

            Answer with 2-3 keywords separated by commas, e.g. "dog, meadow", nothing else.
            """;

    private final OpenRouterClient openRouterClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration timeout;

    public KeywordExtractor(OpenRouterClient openRouterClient,
            ObjectMapper objectMapper,
            @Value("${colecture.models.extraction}") String model,
            @Value("${colecture.timeouts.extraction}") Duration timeout) {
        this.openRouterClient = openRouterClient;
        this.objectMapper = objectMapper;
        this.model = model;
        this.timeout = timeout;
    }

    /**
     * Extrae la intención visual de la diapositiva.
     *
     * @param slide diapositiva de entrada
     * @return intención detallada y keywords refinadas
     * @throws ExtractionException si el LLM no responde o su JSON no es válido
     */
    public KeywordExtraction extract(SlideInput slide) {
        if (slide.hasExplicitKeywords()) {
            List<String> explicit = slide.unsplashSearchTerms();
            log.debug("Keywords explícitas, se omite el LLM: {}", explicit);
            return new KeywordExtraction(ExtractedIntent.fromExplicitKeywords(explicit),
                    joinFirst(explicit));
        }

        String text = slide.plainText();
        ExtractedIntent intent = extractIntent(text);
        if (intent.skip()) {
            log.info("Contenido no apto para imagen: \"{}\"", abbreviate(text));
            return new KeywordExtraction(intent, joinFirst(intent.englishKeywords()));
        }
        return new KeywordExtraction(intent, refine(intent.englishKeywords()));
    }

    // ── Helpers privados ──────────────────────────────────────────────────────

    private ExtractedIntent extractIntent(String text) {
        String raw;
        try {
            raw = openRouterClient.complete(model, EXTRACTION_PROMPT, text, timeout);
        } catch (Exception e) {
            log.error("Error llamando al LLM de extracción: {}", e.getMessage());
            throw new ExtractionException("Fallo en la llamada de extracción: " + e.getMessage(), e);
        }

        String json = OpenRouterClient.stripMarkdownJson(raw);
        if (json.isEmpty()) {
            throw new ExtractionException("El LLM de extracción devolvió una respuesta vacía");
        }
        try {
            ExtractedIntent intent = objectMapper.readValue(json, ExtractedIntent.class);
            if (intent == null) {
                throw new ExtractionException("El LLM de extracción devolvió null");
            }
            return intent.withDistinctKeywords();
        } catch (ExtractionException e) {
            throw e;
        } catch (Exception e) {
            log.error("JSON de extracción inválido ({} chars): {}", json.length(), e.getMessage());
            throw new ExtractionException("Respuesta de extracción no interpretable: " + e.getMessage(), e);
        }
    }

    /**
     * Reduce las keywords a 2-3 términos. Si el LLM falla se usan las primeras keywords.
     */
    private String refine(List<String> keywords) {
        if (keywords.isEmpty()) {
            return "";
        }
        String all = String.join(", ", keywords);
        return IsolatedCall.awaitBlocking("Refinado de keywords",
                        () -> openRouterClient.complete(model, REFINEMENT_PROMPT,
                                "All keywords found: " + all, timeout),
                        timeout)
                .map(refined -> refined.replace("\"", "").strip())
                .filter(refined -> !refined.isEmpty())
                .orElseGet(() -> joinFirst(keywords));
    }

    private static String joinFirst(List<String> keywords) {
        return String.join(", ", keywords.subList(0, Math.min(REFINED_KEYWORD_LIMIT, keywords.size())));
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 77) + "...";
    }
}
