package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.ExtractedIntent;
import com.brixo.colecture.image.model.GenerationFailure;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.GenerationResult;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.model.SlideInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Genera imágenes con el backend elegido por {@link ModelRouter}.
 *
 * El prompt se construye una sola vez por petición ({@link #prepare}); un reintento
 * reutiliza la misma {@link GenerationRequest} cambiando sólo el modelo.
 */
@Service
public class ImageGenerator {

    private static final Logger log = LoggerFactory.getLogger(ImageGenerator.class);

    private final GenerationPromptBuilder promptBuilder;
    private final Map<ImageModel, ImageGenerationBackend> backends = new EnumMap<>(ImageModel.class);

    public ImageGenerator(GenerationPromptBuilder promptBuilder, List<ImageGenerationBackend> backends) {
        this.promptBuilder = promptBuilder;
        backends.forEach(b -> this.backends.put(b.model(), b));
        for (ImageModel model : ImageModel.values()) {
            if (!this.backends.containsKey(model)) {
                log.warn("Sin backend registrado para el modelo {}", model.id());
            }
        }
    }

    /**
     * Construye el prompt de generación para el modelo indicado.
     *
     * @throws ImageGenerationException si el LLM de prompts falla
     */
    public GenerationRequest prepare(SlideInput slide, ExtractedIntent intent, String keywords, ImageModel model) {
        try {
            GenerationPromptBuilder.Prompt prompt = promptBuilder.build(slide, intent, keywords);
            return new GenerationRequest(model, prompt.positive(), prompt.negative(), slide.colors(), slide.style());
        } catch (Exception e) {
            log.error("Error construyendo el prompt de generación: {}", e.getMessage());
            throw new ImageGenerationException("No se pudo construir el prompt: " + e.getMessage(), e);
        }
    }

    /**
     * Ejecuta el backend del modelo de la petición. Nunca lanza: los errores del
     * backend se devuelven como {@link GenerationFailure}.
     */
    public GenerationResult generate(GenerationRequest request) {
        ImageGenerationBackend backend = backends.get(request.model());
        if (backend == null) {
            return new GenerationFailure(request.model(), "Backend no disponible: " + request.model().id());
        }
        long start = System.currentTimeMillis();
        try {
            GenerationResult result = backend.generate(request);
            log.info("Imagen generada con {} en {} ms", request.model().id(), System.currentTimeMillis() - start);
            return result;
        } catch (Exception e) {
            log.error("Error generando con {}: {}", request.model().id(), e.getMessage());
            return new GenerationFailure(request.model(), e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName());
        }
    }
}
