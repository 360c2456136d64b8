package com.brixo.colecture.image.model;

/**
 * Imagen candidata devuelta por un proveedor stock. Sólo vive durante una petición.
 *
 * @param provider         proveedor de origen
 * @param providerId       id nativo del proveedor
 * @param description      texto alternativo o descripción
 * @param previewUrl       URL de tamaño medio, usada para puntuar
 * @param fullUrl          URL a resolución completa, la que se devuelve al cliente
 * @param photographer     autor, puede ser null
 * @param photographerUrl  perfil del autor, puede ser null
 * @param width            ancho en píxeles, puede ser null
 * @param height           alto en píxeles, puede ser null
 */
public record StockCandidate(
        StockProvider provider,
        String providerId,
        String description,
        String previewUrl,
        String fullUrl,
        String photographer,
        String photographerUrl,
        Integer width,
        Integer height
) {
}
