package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Request body para {@code POST /generate-image} y {@code POST /extract-keywords}.
 *
 * @param title               título de la diapositiva (puede estar vacío si hay keywords explícitas)
 * @param bullets             viñetas en orden
 * @param unsplashSearchTerms keywords explícitas; si existen se omite la extracción por LLM
 * @param style               escenario de estilo ({@code flat_illustration}, {@code fine_line}, ...)
 * @param imageMode           {@code stock_only}, {@code ai_only} o {@code auto}
 * @param aiModel             {@code auto}, {@code flux}, {@code imagen} o {@code gemini}
 * @param colors              colores primario/secundario opcionales
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlideInput(
        String title,
        List<BulletPoint> bullets,
        @JsonAlias("keywords") List<String> unsplashSearchTerms,
        String style,
        @JsonProperty("image_mode") ImageMode imageMode,
        @JsonProperty("ai_model") String aiModel,
        ColorHints colors
) {

    public SlideInput {
        title = title != null ? title.strip() : "";
        bullets = bullets != null ? List.copyOf(bullets) : List.of();
        unsplashSearchTerms = unsplashSearchTerms != null
                ? unsplashSearchTerms.stream().filter(k -> k != null && !k.isBlank()).toList()
                : List.of();
        imageMode = imageMode != null ? imageMode : ImageMode.AUTO;
        // Falla al deserializar si el modelo no existe (400 en la API)
        ImageModel.fromRequestId(aiModel);
    }

    public static SlideInput of(String title, List<String> bullets) {
        return new SlideInput(title, bullets.stream().map(b -> BulletPoint.of(b)).toList(),
                null, null, null, null, null);
    }

    public boolean hasExplicitKeywords() {
        return !unsplashSearchTerms.isEmpty();
    }

    public Optional<ImageModel> requestedModel() {
        return ImageModel.fromRequestId(aiModel);
    }

    /**
     * Título, viñetas y sub-viñetas concatenados en un único texto para el LLM.
     */
    public String plainText() {
        List<String> parts = new ArrayList<>();
        if (!title.isBlank()) {
            parts.add(title);
        }
        for (BulletPoint bullet : bullets) {
            if (bullet.bullet() != null && !bullet.bullet().isBlank()) {
                parts.add(bullet.bullet().strip());
            }
            bullet.sub().stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(String::strip)
                    .forEach(parts::add);
        }
        return String.join(" ", parts);
    }
}
