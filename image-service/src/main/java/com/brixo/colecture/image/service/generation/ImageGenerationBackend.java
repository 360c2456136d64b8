package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.ImageModel;

/**
 * Backend de generación de imágenes.
 */
public interface ImageGenerationBackend {

    ImageModel model();

    /**
     * @throws ImageGenerationException si el proveedor falla, rechaza el prompt o no termina a tiempo
     */
    GeneratedImage generate(GenerationRequest request);
}
