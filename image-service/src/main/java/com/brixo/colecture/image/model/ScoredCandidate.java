package com.brixo.colecture.image.model;

import java.util.Comparator;

/**
 * Candidata stock con sus puntuaciones.
 *
 * @param candidate    imagen puntuada
 * @param qualityScore calidad técnica en [0,1]
 * @param safetyScore  probabilidad de que no contenga desnudos en [0,1]
 * @param fitScore     adecuación a la presentación en [0,1], null si no se pudo puntuar
 * @param suitable     resultado de comparar contra los umbrales configurados
 */
public record ScoredCandidate(
        StockCandidate candidate,
        double qualityScore,
        double safetyScore,
        Double fitScore,
        boolean suitable
) {

    /** Calidad descendente; a igualdad, gana el proveedor consultado primero. */
    public static final Comparator<ScoredCandidate> BEST_FIRST = Comparator
            .comparingDouble(ScoredCandidate::qualityScore).reversed()
            .thenComparingInt(s -> s.candidate().provider().priority());
}
