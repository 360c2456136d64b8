package com.brixo.colecture.image.service.provider;

import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.model.StockProvider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Cliente de la API de búsqueda de Pexels ({@code GET /v1/search}).
 */
@Service
public class PexelsClient implements StockPhotoProvider {

    private final WebClient pexelsClient;
    private final boolean configured;

    @Autowired
    public PexelsClient(@Value("${colecture.pexels.base-url}") String baseUrl,
            @Value("${colecture.pexels.api-key:}") String apiKey) {
        this(WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader("Authorization", apiKey)
                        .build(),
                !apiKey.isBlank());
    }

    PexelsClient(WebClient pexelsClient, boolean configured) {
        this.pexelsClient = pexelsClient;
        this.configured = configured;
    }

    @Override
    public StockProvider provider() {
        return StockProvider.PEXELS;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public Mono<List<StockCandidate>> search(String query, int perPage, String orientation) {
        return pexelsClient.get()
                .uri(builder -> {
                    UriBuilder uri = builder.path("/v1/search")
                            .queryParam("query", query)
                            .queryParam("per_page", perPage);
                    if (orientation != null && List.of("landscape", "portrait", "square")
                            .contains(orientation.toLowerCase(Locale.ROOT))) {
                        uri.queryParam("orientation", orientation.toLowerCase(Locale.ROOT));
                    }
                    return uri.build();
                })
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .map(PexelsClient::toCandidates);
    }

    static List<StockCandidate> toCandidates(SearchResponse response) {
        if (response == null || response.photos() == null) {
            return List.of();
        }
        return response.photos().stream()
                .filter(photo -> photo.src() != null)
                .map(photo -> new StockCandidate(
                        StockProvider.PEXELS,
                        photo.id() != null ? String.valueOf(photo.id()) : null,
                        photo.alt(),
                        firstNonBlank(photo.src().large2x(), photo.src().large()),
                        firstNonBlank(photo.src().original(), photo.src().large2x()),
                        photo.photographer(),
                        photo.photographerUrl(),
                        photo.width(),
                        photo.height()))
                .filter(candidate -> candidate.fullUrl() != null && candidate.previewUrl() != null)
                .toList();
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    // ── DTOs de respuesta ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Photo> photos) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Photo(Long id,
            Integer width,
            Integer height,
            String alt,
            String photographer,
            @JsonProperty("photographer_url") String photographerUrl,
            Source src) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Source(String original, String large2x, String large) {
    }
}
