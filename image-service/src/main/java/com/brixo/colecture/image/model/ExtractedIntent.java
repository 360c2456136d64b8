package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Intención visual extraída de la diapositiva, tal como la devuelve el LLM.
 *
 * @param skip             true si el contenido no se presta a una imagen (agenda, cifras...)
 * @param topicsDe         temas cortos en alemán
 * @param englishKeywords  términos de búsqueda en inglés, en orden de relevancia
 * @param style            etiquetas de estilo ("minimal", "aerial", ...)
 * @param negativeKeywords términos a evitar ("text", "watermark", ...)
 * @param constraints      restricciones libres (orientation, color)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedIntent(
        Boolean skip,
        @JsonProperty("topics_de") List<String> topicsDe,
        @JsonProperty("english_keywords") List<String> englishKeywords,
        List<String> style,
        @JsonProperty("negative_keywords") List<String> negativeKeywords,
        Map<String, String> constraints
) {

    public ExtractedIntent {
        skip = Boolean.TRUE.equals(skip);
        topicsDe = distinct(topicsDe);
        englishKeywords = nonBlank(englishKeywords);
        style = distinct(style);
        negativeKeywords = distinct(negativeKeywords);
        constraints = constraints != null ? constraints : Map.of();
    }

    /** Intención sintetizada a partir de keywords explícitas, sin pasar por el LLM; conserva la lista tal cual. */
    public static ExtractedIntent fromExplicitKeywords(List<String> keywords) {
        return new ExtractedIntent(false, List.of(), keywords, List.of(), List.of(), Map.of());
    }

    /** Misma intención con las keywords sin espacios sobrantes ni repetidas. */
    public ExtractedIntent withDistinctKeywords() {
        return new ExtractedIntent(skip, topicsDe, distinct(englishKeywords), style, negativeKeywords, constraints);
    }

    public String orientation() {
        return constraints.get("orientation");
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .toList();
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
    }
}
