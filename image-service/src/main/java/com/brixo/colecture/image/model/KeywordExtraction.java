package com.brixo.colecture.image.model;

/**
 * Resultado completo de la extracción: la intención detallada y el texto de búsqueda refinado.
 * Es también el cuerpo de respuesta de {@code POST /extract-keywords}.
 *
 * @param detailed intención extraída
 * @param refined  2-3 keywords separadas por coma
 */
public record KeywordExtraction(ExtractedIntent detailed, String refined) {
}
