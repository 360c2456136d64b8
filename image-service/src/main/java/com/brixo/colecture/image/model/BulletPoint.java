package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Viñeta de una diapositiva con sus sub-viñetas opcionales.
 *
 * Acepta tanto {@code {"bullet": "...", "sub": [...]}} como un texto plano.
 *
 * @param bullet texto principal de la viñeta
 * @param sub    sub-viñetas (nunca null)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulletPoint(String bullet, List<String> sub) {

    public BulletPoint {
        sub = sub != null ? sub.stream().filter(Objects::nonNull).toList() : List.of();
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public static BulletPoint of(@JsonProperty("bullet") String bullet,
            @JsonProperty("sub") List<String> sub) {
        return new BulletPoint(bullet, sub);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BulletPoint of(String text) {
        return new BulletPoint(text, List.of());
    }
}
