package com.brixo.colecture.image.config;

import com.brixo.colecture.image.service.GeneratedImageCache;
import com.brixo.colecture.image.service.ImageIdGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Beans del pipeline que no son componentes: caché de imágenes generadas y umbrales.
 */
@Configuration
public class ImageServiceConfig {

    /**
     * Caché en memoria acotada por tamaño y TTL.
     * {@code id-strategy}: {@code random} (UUID) o {@code content-hash} (SHA-256).
     */
    @Bean
    public GeneratedImageCache generatedImageCache(
            @Value("${colecture.cache.id-strategy:random}") String idStrategy,
            @Value("${colecture.cache.maximum-entries:500}") long maximumEntries,
            @Value("${colecture.cache.expire-after:6h}") Duration expireAfter) {
        return new GeneratedImageCache(idGenerator(idStrategy), maximumEntries, expireAfter, Clock.systemUTC());
    }

    @Bean
    public ScoringThresholds scoringThresholds(
            @Value("${colecture.scoring.min-quality-score:0.7}") double minQualityScore,
            @Value("${colecture.scoring.min-nudity-safe-score:0.99}") double minNuditySafeScore,
            @Value("${colecture.scoring.min-presentation-score:0.6}") double minPresentationScore) {
        return new ScoringThresholds(minQualityScore, minNuditySafeScore, minPresentationScore);
    }

    static ImageIdGenerator idGenerator(String strategy) {
        return switch (strategy.strip().toLowerCase(Locale.ROOT)) {
            case "random" -> ImageIdGenerator.random();
            case "content-hash" -> ImageIdGenerator.contentHash();
            default -> throw new IllegalArgumentException("colecture.cache.id-strategy desconocida: " + strategy);
        };
    }
}
