package com.brixo.colecture.image.service;

import com.brixo.colecture.image.exception.ProviderException;
import com.brixo.colecture.image.model.CachedImage;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.service.provider.SightengineClient;
import com.brixo.colecture.image.service.provider.SightengineClient.Assessment;
import com.brixo.colecture.image.support.IsolatedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Chequeo de desnudos best-effort sobre imágenes generadas.
 *
 * Si Sightengine falla, agota la cuota o no responde a tiempo el chequeo se omite
 * (resultado vacío) y la imagen se acepta.
 */
@Service
public class SafetyChecker {

    private static final Logger log = LoggerFactory.getLogger(SafetyChecker.class);

    private final SightengineClient sightengineClient;
    private final Duration timeout;

    public SafetyChecker(SightengineClient sightengineClient,
            @Value("${colecture.timeouts.safety-check}") Duration timeout) {
        this.sightengineClient = sightengineClient;
        this.timeout = timeout;
    }

    /**
     * Chequea una imagen alojada externamente.
     *
     * @return probabilidad de imagen segura, o vacío si el chequeo no estuvo disponible
     */
    public Optional<Double> check(ImageModel model, String imageUrl) {
        return run(model, () -> sightengineClient.checkNudity(imageUrl));
    }

    /**
     * Chequea una imagen ya cacheada subiendo sus bytes.
     */
    public Optional<Double> check(ImageModel model, CachedImage image) {
        return run(model, () -> sightengineClient.checkNudity(image.data(), image.mediaType()));
    }

    private Optional<Double> run(ImageModel model, Supplier<Mono<Assessment>> request) {
        Optional<Double> score = IsolatedCall.await("Chequeo de seguridad " + model.id(),
                () -> request.get()
                        .doOnError(ProviderException.class, e -> {
                            if (e.isQuotaExceeded()) {
                                log.warn("Cuota de Sightengine agotada: se omite el chequeo de seguridad");
                            }
                        })
                        .mapNotNull(Assessment::safetyScore),
                timeout);

        score.ifPresentOrElse(
                s -> log.debug("Seguridad de imagen generada ({}): {}", model.id(), s),
                () -> log.info("Chequeo de seguridad omitido para {}: imagen aceptada", model.id()));
        return score;
    }
}
