package com.brixo.colecture.image.model;

/**
 * Un intento de generación. Un reintento produce una nueva instancia con otro modelo.
 *
 * @param model          backend resuelto
 * @param prompt         prompt positivo
 * @param negativePrompt términos a evitar, separados por coma
 * @param colors         colores opcionales (ya incrustados también en el prompt)
 * @param style          escenario de estilo, puede ser null
 */
public record GenerationRequest(
        ImageModel model,
        String prompt,
        String negativePrompt,
        ColorHints colors,
        String style
) {

    public GenerationRequest withModel(ImageModel other) {
        return new GenerationRequest(other, prompt, negativePrompt, colors, style);
    }
}
