package com.brixo.colecture.image.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Respuesta de {@code /generate-image}. Siempre se produce exactamente una por petición.
 *
 * @param url      URL de la imagen; null para {@code none} y, salvo placeholder configurado,
 *                 para {@code failed}
 * @param source   origen de la imagen
 * @param keywords keywords refinadas usadas en la búsqueda
 * @param error    mensaje de error, sólo en {@code failed}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageResult(@JsonInclude(JsonInclude.Include.ALWAYS) String url, ImageSource source, String keywords, String error) {

    public static ImageResult none(String keywords) {
        return new ImageResult(null, ImageSource.NONE, keywords, null);
    }

    public static ImageResult failed(String placeholderUrl, String keywords, String error) {
        return new ImageResult(placeholderUrl, ImageSource.FAILED, keywords, error);
    }

    public static ImageResult of(String url, ImageSource source, String keywords) {
        return new ImageResult(url, source, keywords, null);
    }
}
