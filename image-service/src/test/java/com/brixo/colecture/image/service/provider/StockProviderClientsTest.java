package com.brixo.colecture.image.service.provider;

import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.model.StockProvider;
import com.brixo.colecture.image.support.StubExchangeFunction;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StockProviderClientsTest {

    private static final String UNSPLASH_JSON = """
            {"total": 2, "results": [
              {"id": "u1", "alt_description": "dog on a meadow", "width": 4000, "height": 3000,
               "urls": {"raw": "https://images.unsplash.com/u1", "full": "https://images.unsplash.com/u1?full",
                        "regular": "https://images.unsplash.com/u1?w=1080"},
               "user": {"name": "Ana", "links": {"html": "https://unsplash.com/@ana"}}},
              {"id": "u2", "description": "sin urls"}
            ]}
            """;

    private static final String PEXELS_JSON = """
            {"page": 1, "photos": [
              {"id": 123, "width": 1920, "height": 1080, "alt": "sunny meadow",
               "photographer": "Luis", "photographer_url": "https://pexels.com/@luis",
               "src": {"original": "https://images.pexels.com/123.jpeg",
                       "large2x": "https://images.pexels.com/123.jpeg?w=1880", "large": "https://images.pexels.com/123.jpeg?w=940"}}
            ]}
            """;

    @Test
    void unsplashMapsPhotosAndSkipsIncompleteOnes() {
        StubExchangeFunction stub = StubExchangeFunction.json(UNSPLASH_JSON);

        List<StockCandidate> result = new UnsplashClient(stub.webClient(), true)
                .search("dog meadow", 10, "square").block();

        assertEquals(1, result.size());
        StockCandidate photo = result.get(0);
        assertEquals(StockProvider.UNSPLASH, photo.provider());
        assertEquals("dog on a meadow", photo.description());
        assertEquals("https://images.unsplash.com/u1?w=1080", photo.previewUrl());
        assertEquals("https://images.unsplash.com/u1?full", photo.fullUrl());
        assertEquals("Ana", photo.photographer());
        assertEquals(4000, photo.width());

        URI uri = stub.lastRequest().url();
        assertEquals("/search/photos", uri.getPath());
        assertTrue(uri.getQuery().contains("per_page=10"));
        assertTrue(uri.getQuery().contains("orientation=squarish"));
    }

    @Test
    void pexelsMapsPhotosAndForwardsOrientation() {
        StubExchangeFunction stub = StubExchangeFunction.json(PEXELS_JSON);

        List<StockCandidate> result = new PexelsClient(stub.webClient(), true)
                .search("meadow", 5, "Landscape").block();

        assertEquals(1, result.size());
        StockCandidate photo = result.get(0);
        assertEquals("123", photo.providerId());
        assertEquals("https://images.pexels.com/123.jpeg", photo.fullUrl());
        assertEquals("https://images.pexels.com/123.jpeg?w=1880", photo.previewUrl());
        assertEquals("https://pexels.com/@luis", photo.photographerUrl());

        URI uri = stub.lastRequest().url();
        assertEquals("/v1/search", uri.getPath());
        assertTrue(uri.getQuery().contains("orientation=landscape"));
    }

    @Test
    void unknownOrientationIsNotForwarded() {
        StubExchangeFunction stub = StubExchangeFunction.json("{\"photos\": []}");

        assertTrue(new PexelsClient(stub.webClient(), true).search("x", 5, "panorama").block().isEmpty());
        assertFalse(stub.lastRequest().url().getQuery().contains("orientation"));
    }

    @Test
    void httpErrorsPropagateToTheCaller() {
        StubExchangeFunction stub = new StubExchangeFunction()
                .thenRespond(HttpStatus.UNAUTHORIZED, "{\"errors\": [\"OAuth error\"]}");

        assertThrows(WebClientResponseException.class,
                () -> new UnsplashClient(stub.webClient(), true).search("x", 5, null).block());
    }
}
