package com.brixo.colecture.image.service;

import com.brixo.colecture.image.config.ScoringThresholds;
import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.CachedImage;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationFailure;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.GenerationResult;
import com.brixo.colecture.image.model.ImageMode;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.model.ImageResult;
import com.brixo.colecture.image.model.ImageStyle;
import com.brixo.colecture.image.model.KeywordExtraction;
import com.brixo.colecture.image.model.ScoredCandidate;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.service.generation.ImageGenerator;
import com.brixo.colecture.image.service.generation.ModelRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Coordina el pipeline completo de una diapositiva y devuelve siempre un único
 * {@link ImageResult}.
 *
 * <pre>
 * START → EXTRACTING → SKIPPED | ROUTING
 * ROUTING → STOCK_PATH → SUITABLE | NONE_FOUND (→ AI_PATH en modo auto)
 * AI_PATH → GENERATING → FAILED | GENERATED → SAFETY_CHECK → SAFE | RETRY → DONE
 * </pre>
 *
 * Sólo la extracción de keywords puede terminar en excepción
 * ({@link com.brixo.colecture.image.exception.ExtractionException}).
 */
@Service
public class ImageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ImageOrchestrator.class);

    private final KeywordExtractor keywordExtractor;
    private final ImageSearcher imageSearcher;
    private final ImageScorer imageScorer;
    private final ImageGenerator imageGenerator;
    private final ModelRouter modelRouter;
    private final SafetyChecker safetyChecker;
    private final GeneratedImageCache cache;
    private final ScoringThresholds thresholds;
    private final String publicBaseUrl;
    private final String errorPlaceholderUrl;

    public ImageOrchestrator(KeywordExtractor keywordExtractor,
            ImageSearcher imageSearcher,
            ImageScorer imageScorer,
            ImageGenerator imageGenerator,
            ModelRouter modelRouter,
            SafetyChecker safetyChecker,
            GeneratedImageCache cache,
            ScoringThresholds thresholds,
            @Value("${colecture.public-base-url}") String publicBaseUrl,
            @Value("${colecture.generation.error-placeholder-url:}") String errorPlaceholderUrl) {
        this.keywordExtractor = keywordExtractor;
        this.imageSearcher = imageSearcher;
        this.imageScorer = imageScorer;
        this.imageGenerator = imageGenerator;
        this.modelRouter = modelRouter;
        this.safetyChecker = safetyChecker;
        this.cache = cache;
        this.thresholds = thresholds;
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
        this.errorPlaceholderUrl = errorPlaceholderUrl == null || errorPlaceholderUrl.isBlank()
                ? null
                : errorPlaceholderUrl;
    }

    /**
     * Selecciona la imagen de una diapositiva.
     *
     * @throws com.brixo.colecture.image.exception.ExtractionException si falla la extracción
     */
    public ImageResult process(SlideInput slide) {
        transition(PipelineState.START, PipelineState.EXTRACTING);
        KeywordExtraction extraction = keywordExtractor.extract(slide);
        ExtractedIntent intent = extraction.detailed();
        String keywords = extraction.refined();

        if (intent.skip()) {
            transition(PipelineState.EXTRACTING, PipelineState.SKIPPED);
            return ImageResult.none(keywords);
        }
        transition(PipelineState.EXTRACTING, PipelineState.ROUTING);

        boolean forceAi = slide.imageMode() == ImageMode.AI_ONLY || ImageStyle.isIllustration(slide.style());
        if (!forceAi) {
            transition(PipelineState.ROUTING, PipelineState.STOCK_PATH);
            Optional<ImageResult> stock = stockPath(keywords, intent);
            if (stock.isPresent()) {
                transition(PipelineState.STOCK_PATH, PipelineState.SUITABLE);
                return stock.get();
            }
            transition(PipelineState.STOCK_PATH, PipelineState.NONE_FOUND);
            if (slide.imageMode() == ImageMode.STOCK_ONLY) {
                return ImageResult.none(keywords);
            }
            transition(PipelineState.NONE_FOUND, PipelineState.AI_PATH);
        } else {
            transition(PipelineState.ROUTING, PipelineState.AI_PATH);
        }
        return aiPath(slide, intent, keywords);
    }

    // ── Ruta stock ────────────────────────────────────────────────────────────

    private Optional<ImageResult> stockPath(String keywords, ExtractedIntent intent) {
        List<StockCandidate> candidates = imageSearcher.search(keywords, intent.orientation());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<ScoredCandidate> suitable = imageScorer.filterAndSort(imageScorer.score(candidates, keywords));
        if (suitable.isEmpty()) {
            log.info("Ninguna de las {} candidatas stock supera los umbrales", candidates.size());
            return Optional.empty();
        }
        ScoredCandidate best = suitable.get(0);
        log.info("Imagen stock elegida: {}:{} (calidad {})", best.candidate().provider().id(),
                best.candidate().providerId(), best.qualityScore());
        return Optional.of(ImageResult.of(best.candidate().fullUrl(),
                best.candidate().provider().source(), keywords));
    }

    // ── Ruta IA ───────────────────────────────────────────────────────────────

    private ImageResult aiPath(SlideInput slide, ExtractedIntent intent, String keywords) {
        ImageModel model = modelRouter.route(slide.requestedModel(), slide.style());
        transition(PipelineState.AI_PATH, PipelineState.GENERATING);

        GenerationRequest request;
        try {
            request = imageGenerator.prepare(slide, intent, keywords, model);
        } catch (ImageGenerationException e) {
            return failed(PipelineState.GENERATING, keywords, e.getMessage());
        }

        GenerationResult result = imageGenerator.generate(request);
        if (result instanceof GenerationFailure failure) {
            return failed(PipelineState.GENERATING, keywords, failure.reason());
        }
        transition(PipelineState.GENERATING, PipelineState.GENERATED);

        Published published;
        try {
            published = publish((GeneratedImage) result);
        } catch (IllegalArgumentException e) {
            log.error("Imagen generada por {} no decodificable: {}", model.id(), e.getMessage());
            return failed(PipelineState.GENERATED, keywords, "Imagen generada inválida: " + e.getMessage());
        }

        transition(PipelineState.GENERATED, PipelineState.SAFETY_CHECK);
        Optional<Double> safety = published.cached() != null
                ? safetyChecker.check(model, published.cached())
                : safetyChecker.check(model, published.url());

        if (safety.isEmpty() || thresholds.isSafe(safety.get())) {
            transition(PipelineState.SAFETY_CHECK, PipelineState.SAFE);
            transition(PipelineState.SAFE, PipelineState.DONE);
            return ImageResult.of(published.url(), model.source(), keywords);
        }

        transition(PipelineState.SAFETY_CHECK, PipelineState.RETRY);
        return retryWithSafeModel(request, keywords, safety.get());
    }

    /**
     * Única regeneración con el modelo de respaldo seguro. Su resultado es final:
     * no se vuelve a chequear.
     */
    private ImageResult retryWithSafeModel(GenerationRequest original, String keywords, double safetyScore) {
        ImageModel fallback = modelRouter.safeFallback();
        log.warn("Imagen de {} no segura ({} < {}): se regenera con {}", original.model().id(),
                safetyScore, thresholds.minNuditySafeScore(), fallback.id());

        GenerationResult retry = imageGenerator.generate(original.withModel(fallback));
        if (retry instanceof GenerationFailure failure) {
            return failed(PipelineState.RETRY, keywords, failure.reason());
        }
        try {
            Published published = publish((GeneratedImage) retry);
            transition(PipelineState.RETRY, PipelineState.DONE);
            return ImageResult.of(published.url(), fallback.source(), keywords);
        } catch (IllegalArgumentException e) {
            return failed(PipelineState.RETRY, keywords, "Imagen generada inválida: " + e.getMessage());
        }
    }

    /**
     * Las imágenes en línea pasan por la caché y se sirven desde {@code /generated/{id}};
     * las URLs alojadas se devuelven tal cual.
     */
    private Published publish(GeneratedImage image) {
        if (!image.needsCaching()) {
            return new Published(image.url(), null);
        }
        String id = image.data() != null
                ? cache.store(image.data(), image.mediaType())
                : cache.storeDataUrl(image.url());
        CachedImage cached = cache.retrieve(id)
                .orElseThrow(() -> new IllegalStateException("Imagen recién cacheada no encontrada: " + id));
        return new Published(publicBaseUrl + "/generated/" + id, cached);
    }

    private ImageResult failed(PipelineState from, String keywords, String reason) {
        transition(from, PipelineState.FAILED);
        log.error("Generación fallida: {}", reason);
        return ImageResult.failed(errorPlaceholderUrl, keywords, reason);
    }

    private static void transition(PipelineState from, PipelineState to) {
        log.debug("Pipeline: {} → {}", from, to);
    }

    private record Published(String url, CachedImage cached) {
    }
}
