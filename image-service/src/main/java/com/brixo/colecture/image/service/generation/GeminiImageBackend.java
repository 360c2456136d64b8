package com.brixo.colecture.image.service.generation;

import com.brixo.colecture.image.exception.ImageGenerationException;
import com.brixo.colecture.image.model.GeneratedImage;
import com.brixo.colecture.image.model.GenerationRequest;
import com.brixo.colecture.image.model.ImageModel;
import com.brixo.colecture.image.service.provider.OpenRouterClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Backend Gemini (modelo de imagen) vía chat-completions de OpenRouter con
 * {@code modalities=[image, text]}. La imagen llega como data URL en
 * {@code choices[0].message.images[0].image_url.url}.
 *
 * Es el backend capaz de ilustraciones (flat_illustration, fine_line).
 */
@Component
public class GeminiImageBackend implements ImageGenerationBackend {

    private final OpenRouterClient openRouterClient;
    private final String geminiModel;
    private final Duration timeout;

    public GeminiImageBackend(OpenRouterClient openRouterClient,
            @Value("${colecture.models.gemini-image}") String geminiModel,
            @Value("${colecture.timeouts.generation}") Duration timeout) {
        this.openRouterClient = openRouterClient;
        this.geminiModel = geminiModel;
        this.timeout = timeout;
    }

    @Override
    public ImageModel model() {
        return ImageModel.GEMINI;
    }

    @Override
    public GeneratedImage generate(GenerationRequest request) {
        String prompt = request.prompt();
        if (request.negativePrompt() != null && !request.negativePrompt().isBlank()) {
            prompt = prompt + "\nAvoid: " + request.negativePrompt() + ".";
        }
        var requestBody = Map.of(
                "model", geminiModel,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "modalities", List.of("image", "text"));

        Map<?, ?> response = openRouterClient.post("/chat/completions", requestBody, timeout);
        String imageUrl = extractImageUrl(response);
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new ImageGenerationException("Gemini no devolvió ninguna imagen");
        }
        return GeneratedImage.hosted(ImageModel.GEMINI, imageUrl);
    }

    static String extractImageUrl(Map<?, ?> response) {
        Map<?, ?> message = OpenRouterClient.firstMessage(response);
        if (message == null)
            return null;
        List<?> images = (List<?>) message.get("images");
        if (images == null || images.isEmpty())
            return null;
        Map<?, ?> imageUrl = (Map<?, ?>) ((Map<?, ?>) images.get(0)).get("image_url");
        if (imageUrl == null)
            return null;
        Object url = imageUrl.get("url");
        return url != null ? url.toString() : null;
    }
}
