package com.brixo.colecture.image.model;

import java.time.Instant;

/**
 * Entrada inmutable de la caché de imágenes generadas.
 *
 * @param id        identificador opaco
 * @param data      bytes de la imagen
 * @param mediaType tipo MIME con el que se sirve
 * @param createdAt instante de creación
 */
public record CachedImage(String id, byte[] data, String mediaType, Instant createdAt) {

    public CachedImage {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
