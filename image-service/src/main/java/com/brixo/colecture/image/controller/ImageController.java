package com.brixo.colecture.image.controller;

import com.brixo.colecture.image.exception.InvalidSlideInputException;
import com.brixo.colecture.image.model.BulletPoint;
import com.brixo.colecture.image.model.CachedImage;
import com.brixo.colecture.image.model.ColorHints;
import com.brixo.colecture.image.model.ImageMode;
import com.brixo.colecture.image.model.ImageResult;
import com.brixo.colecture.image.model.KeywordExtraction;
import com.brixo.colecture.image.model.SlideInput;
import com.brixo.colecture.image.service.GeneratedImageCache;
import com.brixo.colecture.image.service.ImageOrchestrator;
import com.brixo.colecture.image.service.KeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * API de selección de imágenes para diapositivas.
 *
 * Una diapositiva entra y siempre sale exactamente un {@link ImageResult}, salvo
 * entrada mal formada (400) o fallo de la extracción de keywords (502).
 */
@RestController
public class ImageController {

    private static final Logger log = LoggerFactory.getLogger(ImageController.class);

    private final ImageOrchestrator orchestrator;
    private final KeywordExtractor keywordExtractor;
    private final GeneratedImageCache cache;

    public ImageController(ImageOrchestrator orchestrator, KeywordExtractor keywordExtractor,
            GeneratedImageCache cache) {
        this.orchestrator = orchestrator;
        this.keywordExtractor = keywordExtractor;
        this.cache = cache;
    }

    /**
     * Busca o genera la imagen de una diapositiva.
     *
     * @param slide título, viñetas, keywords, estilo, modo, modelo y colores
     */
    @PostMapping("/generate-image")
    public ResponseEntity<ImageResult> generateImage(@RequestBody SlideInput slide) {
        validate(slide);
        log.info("Petición de imagen: \"{}\" (modo {}, estilo {})", slide.title(),
                slide.imageMode().wireName(), slide.style());
        return ResponseEntity.ok(orchestrator.process(slide));
    }

    /**
     * Variante GET para pruebas desde el navegador. Las listas admiten valores
     * separados por coma o el parámetro repetido.
     */
    @GetMapping("/generate-image-simple")
    public ResponseEntity<ImageResult> generateImageSimple(
            @RequestParam(required = false) String title,
            @RequestParam(required = false) List<String> bullets,
            @RequestParam(required = false) List<String> keywords,
            @RequestParam(required = false) String style,
            @RequestParam(name = "image_mode", required = false) String imageMode,
            @RequestParam(name = "ai_model", required = false) String aiModel,
            @RequestParam(name = "primary_color", required = false) String primaryColor,
            @RequestParam(name = "secondary_color", required = false) String secondaryColor) {
        SlideInput slide;
        try {
            slide = new SlideInput(title,
                    bullets != null ? bullets.stream().map(b -> BulletPoint.of(b)).toList() : null,
                    keywords,
                    style,
                    ImageMode.fromWireName(imageMode),
                    aiModel,
                    primaryColor != null || secondaryColor != null
                            ? new ColorHints(primaryColor, secondaryColor)
                            : null);
        } catch (IllegalArgumentException e) {
            throw new InvalidSlideInputException(e.getMessage(), e);
        }
        return generateImage(slide);
    }

    /**
     * Sólo la extracción: intención detallada y keywords refinadas.
     */
    @PostMapping("/extract-keywords")
    public ResponseEntity<KeywordExtraction> extractKeywords(@RequestBody SlideInput slide) {
        validate(slide);
        return ResponseEntity.ok(keywordExtractor.extract(slide));
    }

    /**
     * Sirve una imagen generada cacheada con su tipo MIME original.
     */
    @GetMapping("/generated/{id}")
    public ResponseEntity<byte[]> generated(@PathVariable String id) {
        return cache.retrieve(id)
                .map(ImageController::toResponse)
                .orElseGet(() -> {
                    log.debug("Imagen generada no encontrada: {}", id);
                    return ResponseEntity.notFound().build();
                });
    }

    private static ResponseEntity<byte[]> toResponse(CachedImage image) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(image.mediaType()))
                .cacheControl(CacheControl.maxAge(Duration.ofHours(1)))
                .body(image.data());
    }

    private static void validate(SlideInput slide) {
        if (slide == null) {
            throw new InvalidSlideInputException("Cuerpo de la petición vacío");
        }
        if (slide.title().isBlank() && !slide.hasExplicitKeywords()) {
            throw new InvalidSlideInputException("Se requiere title o keywords");
        }
    }
}
