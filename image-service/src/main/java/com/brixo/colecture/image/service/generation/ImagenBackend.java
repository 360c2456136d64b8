package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.service.provider.OpenRouterClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend Imagen vía OpenRouter ({@code POST /images/generations}), síncrono.
 * Devuelve una URL alojada o, si el proveedor responde en base64, los bytes.
 */
@Component
public class ImagenBackend implements ImageGenerationBackend {

    private final OpenRouterClient openRouterClient;
    private final String imagenModel;
    private final String size;
    private final Duration timeout;

    public ImagenBackend(OpenRouterClient openRouterClient,
            @Value("${colecture.models.imagen}") String imagenModel,
            @Value("${colecture.generation.width:1024}") int width,
            @Value("${colecture.generation.height:1024}") int height,
            @Value("${colecture.timeouts.generation}") Duration timeout) {
        this.openRouterClient = openRouterClient;
        this.imagenModel = imagenModel;
        this.size = width + "x" + height;
        this.timeout = timeout;
    }

    @Override
    public ImageModel model() {
        return ImageModel.IMAGEN;
    }

    @Override
    public GeneratedImage generate(GenerationRequest request) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("model", imagenModel);
        requestBody.put("prompt", request.prompt());
        if (request.negativePrompt() != null && !request.negativePrompt().isBlank()) {
            requestBody.put("negative_prompt", request.negativePrompt());
        }
        requestBody.put("n", 1);
        requestBody.put("size", size);

        Map<?, ?> response = openRouterClient.post("/images/generations", requestBody, timeout);
        List<?> data = response != null ? (List<?>) response.get("data") : null;
        if (data == null || data.isEmpty()) {
            throw new ImageGenerationException("Imagen no devolvió ninguna imagen");
        }
        Map<?, ?> first = (Map<?, ?>) data.get(0);
        Object url = first.get("url");
        if (url != null && !url.toString().isBlank()) {
            return GeneratedImage.hosted(ImageModel.IMAGEN, url.toString());
        }
        Object b64 = first.get("b64_json");
        if (b64 != null && !b64.toString().isBlank()) {
            return GeneratedImage.inline(ImageModel.IMAGEN, Base64.getMimeDecoder().decode(b64.toString()), "image/png");
        }
        throw new ImageGenerationException("Respuesta de Imagen sin url ni b64_json");
    }
}
