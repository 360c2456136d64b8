package com.brixo.colecture.image.model;

import java.util.Optional;

/**
 * Backends de generación de imágenes.
 *
 * FLUX: submit/poll, devuelve URL alojada.
 * IMAGEN: síncrono vía OpenRouter, URL o base64.
 * GEMINI: síncrono vía OpenRouter (chat con modalidad imagen), devuelve data URL.
 */
public enum ImageModel {

    FLUX("flux", ImageSource.GENERATED_FLUX),
    IMAGEN("imagen", ImageSource.GENERATED_IMAGEN),
    GEMINI("gemini", ImageSource.GENERATED_GEMINI);

    /** Identificador de petición que delega la elección en el backend primario. */
    public static final String AUTO = "auto";

    private final String id;
    private final ImageSource source;

    ImageModel(String id, ImageSource source) {
        this.id = id;
        this.source = source;
    }

    public String id() {
        return id;
    }

    public ImageSource source() {
        return source;
    }

    /**
     * Interpreta el identificador {@code ai_model} de la petición.
     *
     * @return vacío para {@code auto}, null o cadena vacía
     * @throws IllegalArgumentException si el identificador no corresponde a ningún backend
     */
    public static Optional<ImageModel> fromRequestId(String value) {
        if (value == null || value.isBlank() || AUTO.equalsIgnoreCase(value.strip())) {
            return Optional.empty();
        }
        return Optional.of(fromId(value));
    }

    public static ImageModel fromId(String value) {
        for (ImageModel model : values()) {
            if (model.id.equalsIgnoreCase(value.strip())) {
                return model;
            }
        }
        throw new IllegalArgumentException("ai_model desconocido: " + value);
    }
}
