package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.ImageModel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Backend FLUX (Black Forest Labs), de tipo submit/poll.
 *
 * 1. {@code POST /v1/{modelo}} devuelve {@code polling_url}
 * 2. Espera inicial y sondeo con reintentos acotados y backoff creciente
 * 3. {@code Ready} devuelve {@code result.sample}, una URL alojada
 */
@Component
public class FluxBackend implements ImageGenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(FluxBackend.class);

    private final WebClient fluxClient;
    private final String fluxModel;
    private final int width;
    private final int height;
    private final Duration requestTimeout;
    private final PollPolicy pollPolicy;

    @Autowired
    public FluxBackend(@Value("${colecture.flux.base-url}") String baseUrl,
            @Value("${colecture.flux.api-key:}") String apiKey,
            @Value("${colecture.flux.model:flux-2-pro}") String fluxModel,
            @Value("${colecture.generation.width:1024}") int width,
            @Value("${colecture.generation.height:1024}") int height,
            @Value("${colecture.timeouts.generation}") Duration requestTimeout,
            @Value("${colecture.flux.poll.initial-delay:15s}") Duration initialDelay,
            @Value("${colecture.flux.poll.max-attempts:10}") int maxAttempts,
            @Value("${colecture.flux.poll.backoff:2s}") Duration backoff,
            @Value("${colecture.flux.poll.max-backoff:10s}") Duration maxBackoff) {
        this(WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader("x-key", apiKey)
                        .build(),
                fluxModel, width, height, requestTimeout,
                new PollPolicy(initialDelay, maxAttempts, backoff, maxBackoff));
    }

    FluxBackend(WebClient fluxClient, String fluxModel, int width, int height,
            Duration requestTimeout, PollPolicy pollPolicy) {
        this.fluxClient = fluxClient;
        this.fluxModel = fluxModel;
        this.width = width;
        this.height = height;
        this.requestTimeout = requestTimeout;
        this.pollPolicy = pollPolicy;
    }

    @Override
    public ImageModel model() {
        return ImageModel.FLUX;
    }

    @Override
    public GeneratedImage generate(GenerationRequest request) {
        String pollingUrl = submit(request);
        log.info("FLUX: tarea enviada, sondeando {}", pollingUrl);

        sleep(pollPolicy.initialDelay());
        Duration wait = pollPolicy.backoff();
        for (int attempt = 1; attempt <= pollPolicy.maxAttempts(); attempt++) {
            PollResponse poll = fluxClient.get()
                    .uri(pollingUrl)
                    .retrieve()
                    .bodyToMono(PollResponse.class)
                    .timeout(requestTimeout)
                    .block();
            String status = poll != null && poll.status() != null ? poll.status().toLowerCase(Locale.ROOT) : "";

            switch (status) {
                case "ready", "succeeded" -> {
                    String sample = poll.result() != null ? poll.result().sample() : null;
                    if (sample == null || sample.isBlank()) {
                        throw new ImageGenerationException("FLUX terminó sin imagen");
                    }
                    log.info("FLUX: imagen lista tras {} sondeos", attempt);
                    return GeneratedImage.hosted(ImageModel.FLUX, sample);
                }
                case "error", "failed", "request moderated", "content moderated", "task not found" ->
                        throw new ImageGenerationException("FLUX devolvió estado " + poll.status());
                default -> log.debug("FLUX sondeo {}/{}: {}", attempt, pollPolicy.maxAttempts(), status);
            }

            if (attempt < pollPolicy.maxAttempts()) {
                sleep(wait);
                wait = pollPolicy.next(wait);
            }
        }
        throw new ImageGenerationException("FLUX no terminó tras " + pollPolicy.maxAttempts() + " sondeos");
    }

    private String submit(GenerationRequest request) {
        String prompt = request.prompt();
        if (request.negativePrompt() != null && !request.negativePrompt().isBlank()) {
            // La API de FLUX no tiene campo negativo
            prompt = prompt + " Avoid: " + request.negativePrompt() + ".";
        }
        var requestBody = Map.of(
                "prompt", prompt,
                "width", width,
                "height", height,
                "safety_tolerance", 2,
                "output_format", "jpeg");

        SubmitResponse response = fluxClient.post()
                .uri("/v1/{model}", fluxModel)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(SubmitResponse.class)
                .timeout(requestTimeout)
                .block();

        if (response == null || response.pollingUrl() == null || response.pollingUrl().isBlank()) {
            throw new ImageGenerationException("FLUX no devolvió polling_url");
        }
        return response.pollingUrl();
    }

    private static void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageGenerationException("Sondeo de FLUX interrumpido", e);
        }
    }

    /**
     * @param initialDelay espera antes del primer sondeo
     * @param maxAttempts  número máximo de sondeos
     * @param backoff      espera entre los dos primeros sondeos
     * @param maxBackoff   tope de la espera, que crece un 50 % por sondeo
     */
    record PollPolicy(Duration initialDelay, int maxAttempts, Duration backoff, Duration maxBackoff) {

        Duration next(Duration current) {
            Duration grown = Duration.ofMillis(current.toMillis() * 3 / 2);
            return grown.compareTo(maxBackoff) > 0 ? maxBackoff : grown;
        }
    }

    // ── DTOs de respuesta ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubmitResponse(String id, @JsonProperty("polling_url") String pollingUrl) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PollResponse(String id, String status, Result result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(String sample) {
    }
}
