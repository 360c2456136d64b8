package com.brixo.colecture.image.model;

import java.util.Objects;

/**
 * Imagen generada. Tres formas posibles:
 * <ul>
 * <li>URL externa alojada por el proveedor: se devuelve tal cual</li>
 * <li>data URL ({@code data:image/png;base64,...}): se cachea y se sirve desde {@code /generated/{id}}</li>
 * <li>bytes en línea con su tipo MIME: ídem</li>
 * </ul>
 *
 * @param model     backend que la produjo
 * @param url       URL alojada o data URL; null si la imagen viene como bytes
 * @param data      bytes de la imagen; null si viene como URL
 * @param mediaType tipo MIME de {@code data}
 */
public record GeneratedImage(ImageModel model, String url, byte[] data, String mediaType)
        implements GenerationResult {

    public GeneratedImage {
        Objects.requireNonNull(model, "model");
        if ((url == null) == (data == null)) {
            throw new IllegalArgumentException("Se requiere exactamente una de url o data");
        }
    }

    public static GeneratedImage hosted(ImageModel model, String url) {
        return new GeneratedImage(model, url, null, null);
    }

    public static GeneratedImage inline(ImageModel model, byte[] data, String mediaType) {
        return new GeneratedImage(model, null, data,
                mediaType != null ? mediaType : "application/octet-stream");
    }

    /** True si la imagen debe pasar por la caché antes de poder servirse. */
    public boolean needsCaching() {
        return data != null || url.startsWith("data:");
    }
}
