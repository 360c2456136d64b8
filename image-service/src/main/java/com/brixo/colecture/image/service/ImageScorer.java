package com.brixo.colecture.image.service;

import com.brixo.colecture.image.config.ScoringThresholds;
import com.brixo.colecture.image.model.ScoredCandidate;
import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.service.provider.PresentationFitClient;
import com.brixo.colecture.image.service.provider.SightengineClient;
import com.brixo.colecture.image.service.provider.SightengineClient.Assessment;
import com.brixo.colecture.image.support.IsolatedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Puntúa candidatas stock (calidad, seguridad y, opcionalmente, adecuación) y las filtra.
 *
 * Una candidata que no se puede puntuar se descarta; un fallo de la puntuación de
 * adecuación sólo omite esa puntuación.
 */
@Service
public class ImageScorer {

    private static final Logger log = LoggerFactory.getLogger(ImageScorer.class);

    private final SightengineClient sightengineClient;
    private final PresentationFitClient fitClient;
    private final ScoringThresholds thresholds;
    private final int concurrency;
    private final Duration scoringTimeout;
    private final Duration fitTimeout;

    public ImageScorer(SightengineClient sightengineClient,
            PresentationFitClient fitClient,
            ScoringThresholds thresholds,
            @Value("${colecture.scoring.concurrency:4}") int concurrency,
            @Value("${colecture.timeouts.scoring}") Duration scoringTimeout,
            @Value("${colecture.timeouts.fit-scoring}") Duration fitTimeout) {
        this.sightengineClient = sightengineClient;
        this.fitClient = fitClient;
        this.thresholds = thresholds;
        this.concurrency = Math.max(1, concurrency);
        this.scoringTimeout = scoringTimeout;
        this.fitTimeout = fitTimeout;
    }

    /**
     * Puntúa las candidatas con concurrencia acotada. El orden de salida es el de entrada.
     *
     * @param candidates candidatas deduplicadas
     * @param topic      keywords refinadas, para la puntuación de adecuación
     */
    public List<ScoredCandidate> score(List<StockCandidate> candidates, String topic) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<ScoredCandidate> scored = Flux.fromIterable(candidates)
                .flatMapSequential(candidate -> scoreOne(candidate, topic), concurrency)
                .collectList()
                .blockOptional()
                .orElse(List.of());
        log.debug("Puntuadas {}/{} candidatas", scored.size(), candidates.size());
        return scored;
    }

    /**
     * Sólo las idóneas, por calidad descendente y, a igualdad, por prioridad de proveedor.
     * El orden es estable: a igualdad total se conserva el orden de entrada.
     */
    public List<ScoredCandidate> filterAndSort(List<ScoredCandidate> scored) {
        return scored.stream()
                .filter(ScoredCandidate::suitable)
                .sorted(ScoredCandidate.BEST_FIRST)
                .toList();
    }

    private Mono<ScoredCandidate> scoreOne(StockCandidate candidate, String topic) {
        String label = candidate.provider().id() + ":" + candidate.providerId();

        Mono<Optional<Assessment>> assessment = IsolatedCall
                .isolate("Scoring " + label, () -> sightengineClient.assess(candidate.previewUrl()), scoringTimeout)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());

        Mono<Optional<Double>> fit = fitClient.isEnabled()
                ? IsolatedCall.isolate("Adecuación " + label, () -> fitClient.score(candidate.previewUrl(), topic), fitTimeout)
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                : Mono.just(Optional.empty());

        return Mono.zip(assessment, fit)
                .flatMap(tuple -> {
                    Optional<Assessment> scores = tuple.getT1();
                    if (scores.isEmpty() || scores.get().qualityScore() == null
                            || scores.get().safetyScore() == null) {
                        log.debug("Candidata {} descartada: sin puntuación", label);
                        return Mono.<ScoredCandidate>empty();
                    }
                    double quality = scores.get().qualityScore();
                    double safety = scores.get().safetyScore();
                    Double fitScore = tuple.getT2().orElse(null);
                    return Mono.just(new ScoredCandidate(candidate, quality, safety, fitScore,
                            thresholds.isSuitable(quality, safety, fitScore)));
                });
    }
}
