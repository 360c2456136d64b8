package com.brixo.colecture.image.service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Estrategia de identidad de la caché de imágenes generadas.
 */
@FunctionalInterface
public interface ImageIdGenerator {

    /**
     * @param data bytes que se van a almacenar
     * @return identificador opaco, apto para ir en una ruta URL
     */
    String nextId(byte[] data);

    /** UUID aleatorio en hexadecimal (32 caracteres). */
    static ImageIdGenerator random() {
        return data -> UUID.randomUUID().toString().replace("-", "");
    }

    /** SHA-256 del contenido: los mismos bytes producen siempre el mismo id. */
    static ImageIdGenerator contentHash() {
        return data -> {
            try {
                return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 no disponible", e);
            }
        };
    }
}
