package com.brixo.colecture.image.service.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Cliente del servicio opcional de adecuación a presentaciones ({@code POST /score}).
 * Si no hay URL configurada el cliente queda deshabilitado y no aporta puntuación.
 */
@Service
public class PresentationFitClient {

    private final WebClient scoringClient;

    @Autowired
    public PresentationFitClient(@Value("${colecture.scoring-service.url:}") String baseUrl) {
        this(baseUrl.isBlank() ? null : WebClient.builder().baseUrl(baseUrl).build());
    }

    PresentationFitClient(WebClient scoringClient) {
        this.scoringClient = scoringClient;
    }

    public boolean isEnabled() {
        return scoringClient != null;
    }

    /**
     * @param imageUrl URL de la imagen a evaluar
     * @param topic    keywords del tema de la diapositiva
     * @return puntuación en [0,1]; vacío si el servicio no devuelve puntuación
     */
    public Mono<Double> score(String imageUrl, String topic) {
        if (scoringClient == null) {
            return Mono.empty();
        }
        return scoringClient.post()
                .uri("/score")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("image_url", imageUrl, "topic", topic))
                .retrieve()
                .bodyToMono(ScoreResponse.class)
                .mapNotNull(ScoreResponse::presentationScore);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScoreResponse(@JsonProperty("presentation_score") Double presentationScore) {
    }
}
