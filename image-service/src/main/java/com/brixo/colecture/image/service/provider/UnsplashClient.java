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
 * Cliente de la API de búsqueda de Unsplash ({@code GET /search/photos}).
 */
@Service
public class UnsplashClient implements StockPhotoProvider {

    private final WebClient unsplashClient;
    private final boolean configured;

    @Autowired
    public UnsplashClient(@Value("${colecture.unsplash.base-url}") String baseUrl,
            @Value("${colecture.unsplash.access-key:}") String accessKey) {
        this(WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader("Authorization", "Client-ID " + accessKey)
                        .build(),
                !accessKey.isBlank());
    }

    UnsplashClient(WebClient unsplashClient, boolean configured) {
        this.unsplashClient = unsplashClient;
        this.configured = configured;
    }

    @Override
    public StockProvider provider() {
        return StockProvider.UNSPLASH;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public Mono<List<StockCandidate>> search(String query, int perPage, String orientation) {
        return unsplashClient.get()
                .uri(builder -> {
                    UriBuilder uri = builder.path("/search/photos")
                            .queryParam("query", query)
                            .queryParam("per_page", perPage);
                    String mapped = mapOrientation(orientation);
                    if (mapped != null) {
                        uri.queryParam("orientation", mapped);
                    }
                    return uri.build();
                })
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .map(UnsplashClient::toCandidates);
    }

    static List<StockCandidate> toCandidates(SearchResponse response) {
        if (response == null || response.results() == null) {
            return List.of();
        }
        return response.results().stream()
                .filter(photo -> photo.urls() != null)
                .map(photo -> new StockCandidate(
                        StockProvider.UNSPLASH,
                        photo.id(),
                        firstNonBlank(photo.altDescription(), photo.description()),
                        firstNonBlank(photo.urls().regular(), photo.urls().full()),
                        firstNonBlank(photo.urls().full(), photo.urls().raw()),
                        photo.user() != null ? photo.user().name() : null,
                        photo.user() != null && photo.user().links() != null ? photo.user().links().html() : null,
                        photo.width(),
                        photo.height()))
                .filter(candidate -> candidate.fullUrl() != null && candidate.previewUrl() != null)
                .toList();
    }

    /** Unsplash usa "squarish" en lugar de "square". */
    private static String mapOrientation(String orientation) {
        if (orientation == null) {
            return null;
        }
        return switch (orientation.toLowerCase(Locale.ROOT)) {
            case "landscape", "portrait" -> orientation.toLowerCase(Locale.ROOT);
            case "square", "squarish" -> "squarish";
            default -> null;
        };
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    // ── DTOs de respuesta ─────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Photo> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Photo(String id,
            String description,
            @JsonProperty("alt_description") String altDescription,
            Integer width,
            Integer height,
            Urls urls,
            User user) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Urls(String raw, String full, String regular) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record User(String name, Links links) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Links(String html) {
    }
}
