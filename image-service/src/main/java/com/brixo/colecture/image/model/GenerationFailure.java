package com.brixo.colecture.image.model;

/**
 * Fallo de generación (prompt o backend).
 *
 * @param model  backend que se intentó usar
 * @param reason descripción legible del fallo
 */
public record GenerationFailure(ImageModel model, String reason) implements GenerationResult {
}
