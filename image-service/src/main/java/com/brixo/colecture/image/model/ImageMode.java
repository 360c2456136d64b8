package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Preferencia de origen de la imagen enviada por el cliente.
 */
public enum ImageMode {

    STOCK_ONLY("stock_only"),
    AI_ONLY("ai_only"),
    AUTO("auto");

    private final String wireName;

    ImageMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resuelve el modo desde su nombre de transporte. Null o vacío equivale a {@link #AUTO}.
     *
     * @throws IllegalArgumentException si el valor no es uno de los modos conocidos
     */
    @JsonCreator
    public static ImageMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        for (ImageMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value.strip())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("image_mode desconocido: " + value);
    }
}
