package com.brixo.colecture.image.exception;

/**
 * Fallo al construir el prompt o dentro de un backend de generación. Los fallos de
 * backend se convierten en {@code GenerationFailure} dentro de {@code ImageGenerator}.
 */
public class ImageGenerationException extends RuntimeException {

    public ImageGenerationException(String message) {
        super(message);
    }

    public ImageGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
