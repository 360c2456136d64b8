package com.brixo.colecture.image.service.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Cliente HTTP para OpenRouter (API compatible con OpenAI).
 *
 * Integración exclusivamente vía HTTP / WebClient, sin SDK.
 * {@code POST /chat/completions} para extracción de keywords y prompts,
 * {@code POST /images/generations} y chat multimodal para los backends de imagen.
 */
@Service
public class OpenRouterClient {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterClient.class);

    private final WebClient openRouterClient;

    @Autowired
    public OpenRouterClient(@Value("${colecture.openrouter.base-url}") String baseUrl,
            @Value("${colecture.openrouter.api-key}") String apiKey,
            @Value("${colecture.openrouter.referer:}") String referer,
            @Value("${colecture.openrouter.title:}") String title) {
        this(WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeaders(headers -> {
                    // Cabeceras opcionales recomendadas por OpenRouter
                    if (!referer.isBlank()) {
                        headers.set("HTTP-Referer", referer);
                    }
                    if (!title.isBlank()) {
                        headers.set("X-Title", title);
                    }
                })
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(32 * 1024 * 1024)) // imágenes en base64
                .build());
    }

    OpenRouterClient(WebClient openRouterClient) {
        this.openRouterClient = openRouterClient;
    }

    // ── Chat completions ──────────────────────────────────────────────────────

    /**
     * Llama al modelo de chat con un mensaje de sistema y uno de usuario.
     *
     * @param model        identificador OpenRouter del modelo
     * @param systemPrompt instrucciones de sistema
     * @param userMessage  contenido del usuario
     * @param timeout      presupuesto de la llamada
     * @return texto de la primera respuesta, sin espacios sobrantes (puede estar vacío)
     */
    public String complete(String model, String systemPrompt, String userMessage, Duration timeout) {
        var requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userMessage)));

        Map<?, ?> response = post("/chat/completions", requestBody, timeout);
        String content = extractMessageContent(response);
        log.debug("OpenRouter {} respondió: {} chars", model, content.length());
        return content.strip();
    }

    /**
     * POST genérico con cuerpo JSON; devuelve la respuesta como mapa.
     * Los errores HTTP y el timeout se propagan como excepciones.
     */
    @SuppressWarnings("unchecked")
    public Map<?, ?> post(String uri, Map<String, ?> requestBody, Duration timeout) {
        return openRouterClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(timeout)
                .block();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    static String extractMessageContent(Map<?, ?> response) {
        Map<?, ?> message = firstMessage(response);
        if (message == null)
            return "";
        Object content = message.get("content");
        return content != null ? content.toString() : "";
    }

    /**
     * Primer {@code choices[0].message} de una respuesta de chat, o null.
     */
    public static Map<?, ?> firstMessage(Map<?, ?> response) {
        if (response == null)
            return null;
        List<?> choices = (List<?>) response.get("choices");
        if (choices == null || choices.isEmpty())
            return null;
        return (Map<?, ?>) ((Map<?, ?>) choices.get(0)).get("message");
    }

    /**
     * Elimina los marcadores de bloque de código Markdown que los LLMs a veces
     * añaden.
     */
    public static String stripMarkdownJson(String text) {
        if (text == null)
            return "";
        text = text.strip();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }
}
