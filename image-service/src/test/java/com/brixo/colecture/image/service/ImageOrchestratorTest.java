package com.brixo.colecture.image.service;

import com.brixo.colecture.image.config.ScoringThresholds;
import com.brixo.colecture.image.exception.ExtractionException;
import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.CachedImage;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationFailure;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.ImageMode;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.model.ImageResult;
import com.brixo.colecture.image.model.ImageSource;
import com.brixo.colecture.image.model.KeywordExtraction;
import com.brixo.colecture.image.model.ScoredCandidate;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.model.StockCandidate;
import com.brixo.colecture.image.model.StockProvider;
import com.brixo.colecture.image.service.generation.ImageGenerator;
import com.brixo.colecture.image.service.generation.ModelRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ImageOrchestratorTest {

    private static final String KEYWORDS = "teamwork, office";

    private KeywordExtractor extractor;
    private ImageSearcher searcher;
    private ImageScorer scorer;
    private ImageGenerator generator;
    private SafetyChecker safetyChecker;
    private GeneratedImageCache cache;

    @BeforeEach
    void setUp() {
        extractor = mock(KeywordExtractor.class);
        searcher = mock(ImageSearcher.class);
        scorer = mock(ImageScorer.class);
        generator = mock(ImageGenerator.class);
        safetyChecker = mock(SafetyChecker.class);
        cache = new GeneratedImageCache(ImageIdGenerator.random(), 10, Duration.ofMinutes(5), Clock.systemUTC());

        when(extractor.extract(any())).thenReturn(extraction(false));
        when(scorer.filterAndSort(any())).thenCallRealMethod();
        when(generator.prepare(any(), any(), anyString(), any())).thenAnswer(invocation ->
                new GenerationRequest(invocation.getArgument(3), "prompt", "text, watermark, logo", null, null));
    }

    private ImageOrchestrator orchestrator(String placeholder) {
        return new ImageOrchestrator(extractor, searcher, scorer, generator,
                new ModelRouter(ImageModel.FLUX, ImageModel.GEMINI, ImageModel.IMAGEN),
                safetyChecker, cache, new ScoringThresholds(0.7, 0.99, 0.6),
                "https://images.example.com/", placeholder);
    }

    private ImageOrchestrator orchestrator() {
        return orchestrator("");
    }

    private static KeywordExtraction extraction(boolean skip) {
        return new KeywordExtraction(new ExtractedIntent(skip, List.of(), List.of("teamwork", "office"),
                List.of(), List.of(), Map.of("orientation", "landscape")), KEYWORDS);
    }

    private static SlideInput slide(ImageMode mode, String style, String aiModel) {
        return new SlideInput("Trabajo en equipo", null, null, style, mode, aiModel, null);
    }

    private static StockCandidate candidate(StockProvider provider, String id) {
        return new StockCandidate(provider, id, null, "https://stock/" + id + "/small",
                "https://stock/" + id + "/full", null, null, null, null);
    }

    private static ScoredCandidate scored(StockCandidate candidate, double quality, boolean suitable) {
        return new ScoredCandidate(candidate, quality, 0.999, null, suitable);
    }

    @Test
    void skipIntentGivesNoneWithoutSearching() {
        when(extractor.extract(any())).thenReturn(extraction(true));

        ImageResult result = orchestrator().process(slide(ImageMode.AUTO, null, null));

        assertEquals(ImageSource.NONE, result.source());
        assertNull(result.url());
        verifyNoInteractions(searcher, generator);
    }

    @Test
    void bestSuitableStockPhotoWinsWithProviderTieBreak() {
        StockCandidate pexels = candidate(StockProvider.PEXELS, "p1");
        StockCandidate unsplash = candidate(StockProvider.UNSPLASH, "u1");
        StockCandidate rejected = candidate(StockProvider.UNSPLASH, "u2");
        when(searcher.search(KEYWORDS, "landscape")).thenReturn(List.of(pexels, unsplash, rejected));
        when(scorer.score(anyList(), eq(KEYWORDS))).thenReturn(List.of(
                scored(pexels, 0.9, true), scored(unsplash, 0.9, true), scored(rejected, 0.99, false)));

        ImageResult result = orchestrator().process(slide(ImageMode.AUTO, null, null));

        assertEquals("https://stock/u1/full", result.url());
        assertEquals(ImageSource.STOCK_UNSPLASH, result.source());
        assertEquals(KEYWORDS, result.keywords());
        assertNull(result.error());
        verifyNoInteractions(generator);
    }

    @Test
    void stockOnlyWithoutSuitablePhotoGivesNone() {
        when(searcher.search(anyString(), any())).thenReturn(List.of(candidate(StockProvider.UNSPLASH, "u1")));
        when(scorer.score(anyList(), anyString())).thenReturn(List.of(
                scored(candidate(StockProvider.UNSPLASH, "u1"), 0.5, false)));

        ImageResult result = orchestrator().process(slide(ImageMode.STOCK_ONLY, null, null));

        assertEquals(ImageSource.NONE, result.source());
        assertNull(result.url());
        verifyNoInteractions(generator);
    }

    @Test
    void autoFallsBackToPrimaryGeneratorWhenStockIsEmpty() {
        when(searcher.search(anyString(), any())).thenReturn(List.of());
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/img.jpg"));
        when(safetyChecker.check(ImageModel.FLUX, "https://bfl/img.jpg")).thenReturn(Optional.of(0.999));

        ImageResult result = orchestrator().process(slide(ImageMode.AUTO, null, null));

        assertEquals("https://bfl/img.jpg", result.url());
        assertEquals(ImageSource.GENERATED_FLUX, result.source());
        verify(scorer, never()).score(anyList(), anyString());
    }

    @Test
    void aiOnlyNeverSearchesAndHonoursExplicitModel() {
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.IMAGEN, "https://cdn/i.png"));
        when(safetyChecker.check(eq(ImageModel.IMAGEN), anyString())).thenReturn(Optional.of(1.0));

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, "imagen"));

        assertEquals(ImageSource.GENERATED_IMAGEN, result.source());
        verifyNoInteractions(searcher, scorer);
        verify(generator).prepare(any(), any(), eq(KEYWORDS), eq(ImageModel.IMAGEN));
    }

    @Test
    void illustrationStyleForcesGeminiAndServesInlineImageFromCache() {
        byte[] png = { 1, 2, 3, 4 };
        String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(png);
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.GEMINI, dataUrl));
        when(safetyChecker.check(eq(ImageModel.GEMINI), any(CachedImage.class))).thenReturn(Optional.of(0.995));

        ImageResult result = orchestrator().process(slide(ImageMode.STOCK_ONLY, "flat_illustration", "flux"));

        assertEquals(ImageSource.GENERATED_GEMINI, result.source());
        assertTrue(result.url().startsWith("https://images.example.com/generated/"));
        String id = result.url().substring(result.url().lastIndexOf('/') + 1);
        assertArrayEquals(png, cache.retrieve(id).orElseThrow().data());
        verifyNoInteractions(searcher);
        verify(safetyChecker, never()).check(any(), anyString());
    }

    @Test
    void illustrationStyleSkipsStockSearchInAutoMode() {
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.GEMINI, "https://cdn/ill.png"));
        when(safetyChecker.check(eq(ImageModel.GEMINI), anyString())).thenReturn(Optional.of(1.0));
        SlideInput slide = new SlideInput("Digital Transformation", null, null, "flat_illustration",
                null, null, null);

        ImageResult result = orchestrator().process(slide);

        assertEquals(ImageMode.AUTO, slide.imageMode());
        assertEquals(ImageSource.GENERATED_GEMINI, result.source());
        assertEquals("https://cdn/ill.png", result.url());
        verifyNoInteractions(searcher, scorer);
    }

    @Test
    void safetyScoreAtThresholdIsAcceptedWithoutRetry() {
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/img.jpg"));
        when(safetyChecker.check(ImageModel.FLUX, "https://bfl/img.jpg")).thenReturn(Optional.of(0.99));

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals("https://bfl/img.jpg", result.url());
        assertEquals(ImageSource.GENERATED_FLUX, result.source());
        verify(generator, times(1)).generate(any());
    }

    @Test
    void safetyScoreJustBelowThresholdTriggersRetry() {
        when(generator.generate(any()))
                .thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/img.jpg"))
                .thenReturn(GeneratedImage.hosted(ImageModel.IMAGEN, "https://cdn/safe.png"));
        when(safetyChecker.check(ImageModel.FLUX, "https://bfl/img.jpg"))
                .thenReturn(Optional.of(Math.nextDown(0.99)));

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals("https://cdn/safe.png", result.url());
        assertEquals(ImageSource.GENERATED_IMAGEN, result.source());
        verify(generator, times(2)).generate(any());
    }

    @Test
    void unsafeImageIsRegeneratedOnceWithSafeModel() {
        when(generator.generate(any()))
                .thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/unsafe.jpg"))
                .thenReturn(GeneratedImage.hosted(ImageModel.IMAGEN, "https://cdn/safe.png"));
        when(safetyChecker.check(ImageModel.FLUX, "https://bfl/unsafe.jpg")).thenReturn(Optional.of(0.2));

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals("https://cdn/safe.png", result.url());
        assertEquals(ImageSource.GENERATED_IMAGEN, result.source());

        ArgumentCaptor<GenerationRequest> requests = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generator, times(2)).generate(requests.capture());
        assertEquals(ImageModel.FLUX, requests.getAllValues().get(0).model());
        assertEquals(ImageModel.IMAGEN, requests.getAllValues().get(1).model());
        assertEquals("prompt", requests.getAllValues().get(1).prompt());
        verify(generator, times(1)).prepare(any(), any(), anyString(), any());
        verify(safetyChecker, times(1)).check(any(), anyString());
    }

    @Test
    void failedRetryIsReportedAsFailure() {
        when(generator.generate(any()))
                .thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/unsafe.jpg"))
                .thenReturn(new GenerationFailure(ImageModel.IMAGEN, "cuota agotada"));
        when(safetyChecker.check(any(), anyString())).thenReturn(Optional.of(0.1));

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals(ImageSource.FAILED, result.source());
        assertEquals("cuota agotada", result.error());
    }

    @Test
    void unavailableSafetyProbeAcceptsTheImage() {
        when(generator.generate(any())).thenReturn(GeneratedImage.hosted(ImageModel.FLUX, "https://bfl/img.jpg"));
        when(safetyChecker.check(any(), anyString())).thenReturn(Optional.empty());

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals(ImageSource.GENERATED_FLUX, result.source());
        verify(generator, times(1)).generate(any());
    }

    @Test
    void generationFailureGivesFailedWithoutSafetyCheck() {
        when(generator.generate(any())).thenReturn(new GenerationFailure(ImageModel.FLUX, "FLUX no terminó"));

        ImageResult withoutPlaceholder = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));
        ImageResult withPlaceholder = orchestrator("https://images.example.com/placeholder.png")
                .process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals(ImageSource.FAILED, withoutPlaceholder.source());
        assertNull(withoutPlaceholder.url());
        assertEquals("FLUX no terminó", withoutPlaceholder.error());
        assertEquals("https://images.example.com/placeholder.png", withPlaceholder.url());
        verifyNoInteractions(safetyChecker);
    }

    @Test
    void promptFailureGivesFailed() {
        doThrow(new ImageGenerationException("No se pudo construir el prompt: 503"))
                .when(generator).prepare(any(), any(), anyString(), any());

        ImageResult result = orchestrator().process(slide(ImageMode.AI_ONLY, null, null));

        assertEquals(ImageSource.FAILED, result.source());
        verify(generator, never()).generate(any());
    }

    @Test
    void extractionErrorsPropagate() {
        doThrow(new ExtractionException("LLM caído")).when(extractor).extract(any());

        assertThrows(ExtractionException.class, () -> orchestrator().process(slide(ImageMode.AUTO, null, null)));
    }
}
