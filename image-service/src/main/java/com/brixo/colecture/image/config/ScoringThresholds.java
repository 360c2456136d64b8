package com.brixo.colecture.image.config;

/**
 * Umbrales de idoneidad, todos en [0,1].
 *
 * @param minQualityScore      calidad técnica mínima
 * @param minNuditySafeScore   probabilidad mínima de imagen sin desnudos
 * @param minPresentationScore adecuación mínima a presentaciones (sólo si hay puntuación)
 */
public record ScoringThresholds(double minQualityScore, double minNuditySafeScore,
        double minPresentationScore) {

    public ScoringThresholds {
        requireUnitInterval("min-quality-score", minQualityScore);
        requireUnitInterval("min-nudity-safe-score", minNuditySafeScore);
        requireUnitInterval("min-presentation-score", minPresentationScore);
    }

    public boolean isSafe(double safetyScore) {
        return safetyScore >= minNuditySafeScore;
    }

    /**
     * Una puntuación de adecuación ausente no penaliza.
     */
    public boolean isSuitable(double quality, double safety, Double fit) {
        return quality >= minQualityScore
                && isSafe(safety)
                && (fit == null || fit >= minPresentationScore);
    }

    private static void requireUnitInterval(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " debe estar en [0,1]: " + value);
        }
    }
}
