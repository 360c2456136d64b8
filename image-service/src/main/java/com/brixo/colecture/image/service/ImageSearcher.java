package com.brixo.colecture.image.service;

import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.service.provider.StockPhotoProvider;
import com.brixo.colecture.image.support.IsolatedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Busca en todos los proveedores stock configurados en paralelo y fusiona los resultados.
 *
 * El orden de salida es determinista: proveedores en orden de prioridad y, dentro de cada
 * uno, el orden devuelto por su API. Los duplicados (misma URL normalizada) se descartan
 * conservando la primera aparición.
 */
@Service
public class ImageSearcher {

    private static final Logger log = LoggerFactory.getLogger(ImageSearcher.class);

    private final List<StockPhotoProvider> providers;
    private final int perPage;
    private final Duration providerTimeout;
    private final Duration overallTimeout;

    public ImageSearcher(List<StockPhotoProvider> providers,
            @Value("${colecture.search.per-page:10}") int perPage,
            @Value("${colecture.timeouts.search}") Duration providerTimeout,
            @Value("${colecture.timeouts.search-overall}") Duration overallTimeout) {
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(p -> p.provider().priority()))
                .toList();
        this.perPage = perPage;
        this.providerTimeout = providerTimeout;
        this.overallTimeout = overallTimeout;

        this.providers.stream()
                .filter(p -> !p.isConfigured())
                .forEach(p -> log.warn("Proveedor {} sin credenciales: no se consultará", p.provider().id()));
    }

    /**
     * @param query       keywords refinadas
     * @param orientation restricción de orientación de la intención, puede ser null
     * @return candidatas deduplicadas; vacía si ningún proveedor responde dentro de su plazo
     */
    public List<StockCandidate> search(String query, String orientation) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        // Llamadas en paralelo: el plazo global acota cada una por separado
        Duration budget = providerTimeout.compareTo(overallTimeout) <= 0 ? providerTimeout : overallTimeout;
        List<List<StockCandidate>> perProvider = Flux.fromIterable(providers)
                .filter(StockPhotoProvider::isConfigured)
                .flatMapSequential(p -> IsolatedCall.isolate(
                                "Búsqueda " + p.provider().id(),
                                () -> p.search(query, perPage, orientation),
                                budget)
                        .doOnNext(found -> log.debug("{}: {} resultados para \"{}\"",
                                p.provider().id(), found.size(), query)))
                .collectList()
                .blockOptional()
                .orElse(List.of());

        List<StockCandidate> merged = deduplicate(perProvider);
        log.info("Búsqueda stock \"{}\": {} candidatas", query, merged.size());
        return merged;
    }

    static List<StockCandidate> deduplicate(List<List<StockCandidate>> perProvider) {
        Set<String> seen = new HashSet<>();
        List<StockCandidate> merged = new ArrayList<>();
        for (List<StockCandidate> candidates : perProvider) {
            for (StockCandidate candidate : candidates) {
                if (seen.add(normalizeUrl(candidate.fullUrl()))) {
                    merged.add(candidate);
                }
            }
        }
        return merged;
    }

    /**
     * Esquema y host en minúsculas, sin query, sin fragmento y sin barra final.
     */
    static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.strip();
        try {
            URI uri = URI.create(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return stripTrailingSlash(trimmed);
            }
            String path = uri.getRawPath() != null ? uri.getRawPath() : "";
            String port = uri.getPort() >= 0 ? ":" + uri.getPort() : "";
            return stripTrailingSlash(uri.getScheme().toLowerCase(Locale.ROOT) + "://"
                    + uri.getHost().toLowerCase(Locale.ROOT) + port + path);
        } catch (IllegalArgumentException e) {
            return stripTrailingSlash(trimmed);
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
