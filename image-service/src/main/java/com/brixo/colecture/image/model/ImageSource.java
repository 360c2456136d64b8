package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origen de la imagen final. {@link #NONE} significa que no había candidata;
 * {@link #FAILED} que la generación falló.
 */
public enum ImageSource {

    STOCK_UNSPLASH("stock_unsplash"),
    STOCK_PEXELS("stock_pexels"),
    GENERATED_FLUX("generated_flux"),
    GENERATED_IMAGEN("generated_imagen"),
    GENERATED_GEMINI("generated_gemini"),
    NONE("none"),
    FAILED("failed");

    private final String tag;

    ImageSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
