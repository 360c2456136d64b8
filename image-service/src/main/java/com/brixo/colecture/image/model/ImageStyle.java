package com.brixo.colecture.image.model;

import java.util.Optional;

/**
 * Escenarios de estilo conocidos. Cualquier otro valor de {@code style} se trata como
 * una pista libre para el prompt.
 */
public enum ImageStyle {

    FLAT_ILLUSTRATION("flat_illustration", true),
    FINE_LINE("fine_line", true),
    PHOTOREALISTIC("photorealistic", false);

    private final String tag;
    private final boolean illustration;

    ImageStyle(String tag, boolean illustration) {
        this.tag = tag;
        this.illustration = illustration;
    }

    public String tag() {
        return tag;
    }

    /** Los estilos de ilustración fuerzan la ruta IA y un backend capaz de ilustrar. */
    public boolean isIllustration() {
        return illustration;
    }

    public static Optional<ImageStyle> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (ImageStyle style : values()) {
            if (style.tag.equalsIgnoreCase(value.strip())) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }

    public static boolean isIllustration(String value) {
        return fromTag(value).map(ImageStyle::isIllustration).orElse(false);
    }
}
