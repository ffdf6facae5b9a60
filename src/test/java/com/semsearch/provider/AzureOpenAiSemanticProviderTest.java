package com.semsearch.provider;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AzureOpenAiSemanticProviderTest {

    private MockWebServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCallEmbeddingDeploymentWithApiKey() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"data": [{"embedding": [0.25, -0.5, 1.0]}], "usage": {"prompt_tokens": 3, "total_tokens": 3}}
                """));

        EmbeddingResult result = provider(ProviderCredential.apiKey("secret")).embed("hello world");

        assertArrayEquals(new float[] { 0.25f, -0.5f, 1.0f }, result.vector());
        assertEquals(new TokenUsage(3, 0, 3), result.usage());
        RecordedRequest request = server.takeRequest();
        assertEquals("/openai/deployments/embed-dep/embeddings?api-version=2024-02-01", request.getPath());
        assertEquals("secret", request.getHeader("api-key"));
        assertNull(request.getHeader("Authorization"));
        assertTrue(request.getBody().readUtf8().contains("\"input\":\"hello world\""));
    }

    @Test
    void shouldSummarizeThroughChatDeploymentWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"message": {"role": "assistant", "content": "  A short summary.  "}}],
                 "usage": {"prompt_tokens": 120, "completion_tokens": 8, "total_tokens": 128}}
                """));

        SummaryResult result = provider(ProviderCredential.bearerToken(() -> "token-1")).summarize("0123456789", 4);

        assertEquals("A short summary.", result.summary());
        assertTrue(result.truncated());
        assertEquals(new TokenUsage(120, 8, 128), result.usage());
        RecordedRequest request = server.takeRequest();
        assertEquals("/openai/deployments/chat-dep/chat/completions?api-version=2024-02-01", request.getPath());
        assertEquals("Bearer token-1", request.getHeader("Authorization"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"temperature\":0"));
        assertTrue(body.contains("Summarize this."));
        assertTrue(body.contains("0123"));
        assertFalse(body.contains("01234"));
    }

    @Test
    void shouldParseFencedRerankAnswer() {
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"message": {"content": "```json\\n[{\\"id\\": \\"b\\", \\"score\\": 88}]\\n```"}}]}
                """));

        RerankOutcome outcome = provider(ProviderCredential.apiKey("secret")).rerank("query", List.of(
                new RerankCandidate("a", "first"),
                new RerankCandidate("b", "second")), 5);

        assertFalse(outcome.isFallback());
        assertEquals(List.of(new RankedId("b", 88)), outcome.ranking());
    }

    @Test
    void shouldFallBackWhenRerankContentIsFiltered() {
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"finish_reason": "content_filter", "message": {"content": null}}]}
                """));

        RerankOutcome outcome = provider(ProviderCredential.apiKey("secret")).rerank("query", List.of(
                new RerankCandidate("a", "first"),
                new RerankCandidate("b", "second")), 5);

        assertTrue(outcome.isFallback());
        assertEquals(List.of(new RankedId("a", 2), new RankedId("b", 1)), outcome.ranking());
    }

    @Test
    void shouldSkipHttpCallForEmptyRerank() {
        RerankOutcome outcome = provider(ProviderCredential.apiKey("secret")).rerank("query", List.of(), 5);

        assertTrue(outcome.ranking().isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldRaiseProviderExceptionOnHttpError() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\": {\"message\": \"Rate limit\"}}"));

        ProviderException error = assertThrows(ProviderException.class,
                () -> provider(ProviderCredential.apiKey("secret")).embed("text"));

        assertTrue(error.getMessage().contains("429"));
        assertTrue(error.getMessage().contains("embed-dep"));
    }

    @Test
    void shouldRaiseProviderExceptionOnMissingChoices() {
        server.enqueue(new MockResponse().setBody("{\"choices\": []}"));

        assertThrows(ProviderException.class,
                () -> provider(ProviderCredential.apiKey("secret")).summarize("text", 100));
    }

    private AzureOpenAiSemanticProvider provider(ProviderCredential credential) {
        ProviderSettings settings = new ProviderSettings(
                server.url("/").toString(),
                "2024-02-01",
                "embed-dep",
                "chat-dep",
                "Summarize this.",
                "Rank these.");
        return new AzureOpenAiSemanticProvider(new OkHttpClient(), settings, credential);
    }
}
