package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.ProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Chat Completions Provider Tests")
class ChatCompletionsProviderTest {

    private static final String RESPONSE = """
            {"choices": [{"message": {"role": "assistant", "content": "[\\"q1\\", \\"q2\\"]"}}],
             "usage": {"prompt_tokens": 2000, "completion_tokens": 500}}""";

    private static final LLMRequest REQUEST = LLMRequest.builder().userPrompt("Generate queries").build();

    @Test
    @DisplayName("OpenAI: bearer auth against the chat completions path")
    void testOpenAi() {
        // Given
        StubExchange exchange = StubExchange.ok(RESPONSE);
        OpenAiProvider provider = new OpenAiProvider(exchange.builder(), StubExchange.noRetry(), new AppProperties());
        RequestCredentials credentials = RequestCredentials.builder()
                .llmProvider(ProviderType.OPENAI).llmApiKey("sk-test").build();

        // When
        LLMCompletion completion = provider.complete(REQUEST, credentials);

        // Then
        assertEquals("[\"q1\", \"q2\"]", completion.getContent());
        assertEquals(2000, completion.getInputTokens());
        assertEquals((2000 * 0.15 + 500 * 0.60) / 1_000_000d, completion.getCost(), 1e-12);
        assertEquals("https://api.openai.com/v1/chat/completions", exchange.lastRequest().url().toString());
        assertEquals("Bearer sk-test", exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("Azure: deployment URL, api-version and api-key header")
    void testAzure() {
        StubExchange exchange = StubExchange.ok(RESPONSE);
        AzureOpenAiProvider provider = new AzureOpenAiProvider(exchange.builder(), StubExchange.noRetry(), new AppProperties());
        RequestCredentials credentials = RequestCredentials.builder()
                .llmProvider(ProviderType.AZURE)
                .llmApiKey("azure-key")
                .llmEndpoint("https://acme.openai.azure.com/")
                .llmDeployment("gpt4o-prod")
                .build();

        provider.complete(REQUEST, credentials);

        assertEquals("https://acme.openai.azure.com/openai/deployments/gpt4o-prod/chat/completions?api-version=2024-02-15-preview",
                exchange.lastRequest().url().toString());
        assertEquals("azure-key", exchange.lastRequest().headers().getFirst("api-key"));
        assertNull(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("Server errors carry the provider status")
    void testServerError() {
        StubExchange exchange = new StubExchange(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        OpenAiProvider provider = new OpenAiProvider(exchange.builder(), StubExchange.noRetry(), new AppProperties());
        RequestCredentials credentials = RequestCredentials.builder()
                .llmProvider(ProviderType.OPENAI).llmApiKey("sk-test").build();

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.complete(REQUEST, credentials));

        assertEquals(503, ex.getStatusCode());
        assertFalse(ex.isRejected());
    }

    @Test
    @DisplayName("Factory resolves each registered backend by type")
    void testFactory() {
        AppProperties props = new AppProperties();
        StubExchange exchange = StubExchange.ok(RESPONSE);
        OpenAiProvider openAi = new OpenAiProvider(exchange.builder(), StubExchange.noRetry(), props);
        AnthropicProvider anthropic = new AnthropicProvider(exchange.builder(), StubExchange.noRetry(), props);

        LLMProviderFactory factory = new LLMProviderFactory(List.of(openAi, anthropic));

        assertSame(openAi, factory.getProvider(ProviderType.OPENAI));
        assertSame(anthropic, factory.getProvider(ProviderType.ANTHROPIC));
        assertThrows(IllegalStateException.class, () -> factory.getProvider(ProviderType.AZURE));
    }
}
