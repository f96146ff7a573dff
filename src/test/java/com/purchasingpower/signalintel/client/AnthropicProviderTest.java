package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.ProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Anthropic Provider Tests")
class AnthropicProviderTest {

    private static final RequestCredentials CREDENTIALS = RequestCredentials.builder()
            .llmProvider(ProviderType.ANTHROPIC)
            .llmApiKey("sk-ant-test")
            .build();

    private static final LLMRequest REQUEST = LLMRequest.builder()
            .systemPrompt("Return JSON.")
            .userPrompt("Extract companies")
            .jsonMode(true)
            .build();

    @Test
    @DisplayName("Text block is returned without its code fence and usage is priced")
    void testComplete() {
        // Given
        StubExchange exchange = StubExchange.ok("""
                {"content": [{"type": "text", "text": "```json\\n{\\"companies\\": []}\\n```"}],
                 "usage": {"input_tokens": 1000000, "output_tokens": 1000000}}""");
        AnthropicProvider provider = new AnthropicProvider(exchange.builder(), StubExchange.noRetry(), new AppProperties());

        // When
        LLMCompletion completion = provider.complete(REQUEST, CREDENTIALS);

        // Then
        assertEquals("{\"companies\": []}", completion.getContent());
        assertEquals(1.50, completion.getCost(), 1e-9);
        assertEquals("https://api.anthropic.com/v1/messages", exchange.lastRequest().url().toString());
        assertEquals("sk-ant-test", exchange.lastRequest().headers().getFirst("x-api-key"));
        assertEquals("2023-06-01", exchange.lastRequest().headers().getFirst("anthropic-version"));
    }

    @Test
    @DisplayName("Rejected key is reported as a rejection")
    void testRejected() {
        StubExchange exchange = new StubExchange(HttpStatus.UNAUTHORIZED,
                "{\"type\":\"error\",\"error\":{\"type\":\"authentication_error\"}}");
        AnthropicProvider provider = new AnthropicProvider(exchange.builder(), StubExchange.noRetry(), new AppProperties());

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.complete(REQUEST, CREDENTIALS));

        assertTrue(ex.isRejected());
    }
}
