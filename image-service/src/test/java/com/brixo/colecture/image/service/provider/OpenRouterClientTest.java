package com.brixo.colecture.image.service.provider;

import com.brixo.colecture.image.support.StubExchangeFunction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenRouterClientTest {

    @Test
    void completeReturnsFirstChoiceContent() {
        StubExchangeFunction stub = StubExchangeFunction.json("""
                {"id": "gen-1", "choices": [{"message": {"role": "assistant", "content": "  dog, meadow \\n"}}]}
                """);

        String content = new OpenRouterClient(stub.webClient())
                .complete("google/gemini-2.0-flash-001", "system", "user", Duration.ofSeconds(2));

        assertEquals("dog, meadow", content);
        assertEquals("/chat/completions", stub.lastRequest().url().getPath());
    }

    @Test
    void missingChoicesGiveEmptyContent() {
        assertEquals("", OpenRouterClient.extractMessageContent(Map.of("choices", List.of())));
        assertEquals("", OpenRouterClient.extractMessageContent(null));
        assertNull(OpenRouterClient.firstMessage(Map.of()));
    }

    @Test
    void stripsMarkdownFences() {
        assertEquals("{\"a\":1}", OpenRouterClient.stripMarkdownJson("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", OpenRouterClient.stripMarkdownJson("```{\"a\":1}```"));
        assertEquals("plain", OpenRouterClient.stripMarkdownJson(" plain "));
        assertEquals("", OpenRouterClient.stripMarkdownJson(null));
    }
}
