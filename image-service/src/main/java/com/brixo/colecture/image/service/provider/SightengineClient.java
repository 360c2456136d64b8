package com.brixo.colecture.image.service.provider;

import com.brixo.colecture.image.exception.ProviderException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.stream.Stream;

/**
 * Cliente de Sightengine ({@code /1.0/check.json}): calidad técnica y detección de desnudos.
 *
 * Una sola llamada por imagen con {@code models=quality,nudity-2.1}. Las imágenes generadas
 * en línea se suben como multipart porque su URL pública puede no ser alcanzable.
 */
@Service
public class SightengineClient {

    static final String PROVIDER = "sightengine";
    static final String QUALITY_AND_NUDITY = "quality,nudity-2.1";
    static final String NUDITY = "nudity-2.1";

    private final WebClient sightengineClient;
    private final String apiUser;
    private final String apiSecret;

    @Autowired
    public SightengineClient(@Value("${colecture.sightengine.base-url}") String baseUrl,
            @Value("${colecture.sightengine.api-user:}") String apiUser,
            @Value("${colecture.sightengine.api-secret:}") String apiSecret) {
        this(WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16 MB para imágenes
                .build(), apiUser, apiSecret);
    }

    SightengineClient(WebClient sightengineClient, String apiUser, String apiSecret) {
        this.sightengineClient = sightengineClient;
        this.apiUser = apiUser;
        this.apiSecret = apiSecret;
    }

    /**
     * Calidad y seguridad de una imagen accesible por URL.
     */
    public Mono<Assessment> assess(String imageUrl) {
        return checkUrl(imageUrl, QUALITY_AND_NUDITY);
    }

    /**
     * Sólo seguridad (desnudos) de una imagen accesible por URL.
     */
    public Mono<Assessment> checkNudity(String imageUrl) {
        return checkUrl(imageUrl, NUDITY);
    }

    /**
     * Sólo seguridad de una imagen en memoria, subida como {@code media}.
     */
    public Mono<Assessment> checkNudity(byte[] image, String mediaType) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("media", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "image" + extensionFor(mediaType);
            }
        }).contentType(mediaType != null ? MediaType.parseMediaType(mediaType) : MediaType.APPLICATION_OCTET_STREAM);
        body.part("models", NUDITY);
        body.part("api_user", apiUser);
        body.part("api_secret", apiSecret);

        return sightengineClient.post()
                .uri("/1.0/check.json")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(CheckResponse.class)
                .flatMap(SightengineClient::toAssessment);
    }

    private Mono<Assessment> checkUrl(String imageUrl, String models) {
        return sightengineClient.get()
                .uri(builder -> builder.path("/1.0/check.json")
                        .queryParam("models", models)
                        .queryParam("api_user", apiUser)
                        .queryParam("api_secret", apiSecret)
                        .queryParam("url", imageUrl)
                        .build())
                .retrieve()
                .bodyToMono(CheckResponse.class)
                .flatMap(SightengineClient::toAssessment);
    }

    static Mono<Assessment> toAssessment(CheckResponse response) {
        if (response == null) {
            return Mono.error(new ProviderException(PROVIDER, "respuesta vacía", false));
        }
        if (!"success".equalsIgnoreCase(response.status())) {
            String type = response.error() != null ? response.error().type() : null;
            String message = response.error() != null ? response.error().message() : "estado " + response.status();
            boolean quota = type != null && (type.contains("usage_limit") || type.contains("rate_limit"));
            return Mono.error(new ProviderException(PROVIDER, message, quota));
        }
        Double quality = response.quality() != null ? response.quality().score() : null;
        Double safety = response.nudity() != null ? response.nudity().safeScore() : null;
        return Mono.just(new Assessment(quality, safety));
    }

    private static String extensionFor(String mediaType) {
        if (mediaType == null) {
            return "";
        }
        return switch (mediaType) {
            case "image/png" -> ".png";
            case "image/webp" -> ".webp";
            case "image/jpeg", "image/jpg" -> ".jpg";
            default -> "";
        };
    }

    /**
     * @param qualityScore calidad en [0,1], null si no se pidió
     * @param safetyScore  probabilidad de imagen sin desnudos en [0,1], null si no se pidió
     */
    public record Assessment(Double qualityScore, Double safetyScore) {
    }

    // ── DTOs de respuesta ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckResponse(String status, Quality quality, Nudity nudity, ErrorInfo error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Quality(Double score) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorInfo(String type, Integer code, String message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Nudity(
            @JsonProperty("sexual_activity") Double sexualActivity,
            @JsonProperty("sexual_display") Double sexualDisplay,
            Double erotica,
            @JsonProperty("very_suggestive") Double verySuggestive,
            Double suggestive,
            Double none) {

        /**
         * {@code none} si viene en la respuesta; si no, 1 menos la clase explícita más probable.
         */
        double safeScore() {
            if (none != null) {
                return none;
            }
            double worst = Stream.of(sexualActivity, sexualDisplay, erotica, verySuggestive, suggestive)
                    .filter(v -> v != null)
                    .mapToDouble(Double::doubleValue)
                    .max()
                    .orElse(0.0);
            return 1.0 - worst;
        }
    }
}
