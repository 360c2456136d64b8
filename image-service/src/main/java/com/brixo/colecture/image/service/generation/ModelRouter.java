package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.model.ImageStyle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tabla de enrutado de modelos. Función pura del modelo pedido y del estilo.
 */
@Component
public class ModelRouter {

    private final ImageModel primary;
    private final ImageModel illustration;
    private final ImageModel safeFallback;

    @Autowired
    public ModelRouter(@Value("${colecture.generation.primary-model:flux}") String primary,
            @Value("${colecture.generation.illustration-model:gemini}") String illustration,
            @Value("${colecture.generation.safe-fallback-model:imagen}") String safeFallback) {
        this(ImageModel.fromId(primary), ImageModel.fromId(illustration), ImageModel.fromId(safeFallback));
    }

    public ModelRouter(ImageModel primary, ImageModel illustration, ImageModel safeFallback) {
        this.primary = primary;
        this.illustration = illustration;
        this.safeFallback = safeFallback;
    }

    /**
     * Los estilos de ilustración mandan sobre el modelo pedido; sin modelo explícito
     * se usa el primario.
     */
    public ImageModel route(Optional<ImageModel> requested, String style) {
        if (ImageStyle.isIllustration(style)) {
            return illustration;
        }
        return requested.orElse(primary);
    }

    /** Modelo usado para la única regeneración tras un chequeo de seguridad fallido. */
    public ImageModel safeFallback() {
        return safeFallback;
    }
}
