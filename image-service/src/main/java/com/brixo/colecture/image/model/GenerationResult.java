package com.brixo.colecture.image.model;

/**
 * Resultado de un intento de generación: imagen o fallo, nunca excepción.
 */
public sealed interface GenerationResult permits GeneratedImage, GenerationFailure {

    ImageModel model();
}
