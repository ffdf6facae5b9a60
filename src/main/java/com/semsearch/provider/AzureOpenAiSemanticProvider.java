package com.semsearch.provider;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Azure OpenAI deployments over REST: a chat deployment for summaries and reranking, an embeddings deployment for
 * vectors. Every call is made once; HTTP and envelope errors become {@link ProviderException}.
 */
public class AzureOpenAiSemanticProvider implements SemanticProvider {
    private static final Logger log = LoggerFactory.getLogger(AzureOpenAiSemanticProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int ERROR_BODY_LIMIT = 300;

    private final OkHttpClient httpClient;
    private final ProviderSettings settings;
    private final ProviderCredential credential;
    private final ObjectMapper mapper;
    private final RerankOutputParser rerankParser;
    private final HttpUrl baseUrl;

    public AzureOpenAiSemanticProvider(OkHttpClient httpClient, ProviderSettings settings, ProviderCredential credential) {
        this.httpClient = httpClient;
        this.settings = settings;
        this.credential = credential;
        this.mapper = new ObjectMapper();
        this.rerankParser = new RerankOutputParser(mapper);
        this.baseUrl = HttpUrl.parse(settings.endpoint());
        if (baseUrl == null) {
            throw new IllegalArgumentException("Invalid endpoint URL: " + settings.endpoint());
        }
    }

    @Override
    public SummaryResult summarize(String text, int maxChars) {
        String body = text == null ? "" : text;
        boolean truncated = maxChars > 0 && body.length() > maxChars;
        if (truncated) {
            body = body.substring(0, maxChars);
        }
        String prompt = settings.summarizationPrompt() + "\n\nTEXT BEGIN\n" + body + "\nTEXT END";
        JsonNode response = chat(List.of(
                message("system", "You are a helpful assistant that writes concise, factual summaries."),
                message("user", prompt)));
        return new SummaryResult(firstChoiceContent(response).strip(), truncated, usage(response));
    }

    @Override
    public EmbeddingResult embed(String text) {
        HttpUrl url = deploymentUrl(settings.embeddingDeployment(), "embeddings");
        JsonNode response = post(url, Map.of("input", text == null ? "" : text), "embedding", settings.embeddingDeployment());
        JsonNode vectorNode = response.path("data").path(0).path("embedding");
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new ProviderException("Embedding deployment '" + settings.embeddingDeployment() + "' returned no vector");
        }
        float[] vector = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            vector[i] = (float) vectorNode.get(i).asDouble();
        }
        JsonNode usage = response.path("usage");
        return new EmbeddingResult(vector, new TokenUsage(
                usage.path("prompt_tokens").asLong(0),
                0,
                usage.path("total_tokens").asLong(0)));
    }

    @Override
    public RerankOutcome rerank(String query, List<RerankCandidate> candidates, int topK) {
        if (candidates.isEmpty()) {
            return RerankOutcome.parsed(List.of());
        }
        StringBuilder items = new StringBuilder();
        for (RerankCandidate candidate : candidates) {
            items.append("ID: ").append(candidate.id()).append('\n')
                    .append("SUMMARY: ").append(candidate.summary()).append("\n\n");
        }
        String prompt = settings.rerankPrompt()
                + "\n\nQuery: " + query
                + "\n\nFor each item, output a JSON array of {\"id\": string, \"score\": number} with score 0-100. "
                + "Only output JSON.\n\nITEMS:\n" + items.toString().strip();
        JsonNode response = chat(List.of(
                message("system", "You are a precise reranker. Only output strict JSON."),
                message("user", prompt)));
        // content is null when the completion was filtered
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return rerankParser.parse(content.isTextual() ? content.asText() : null, candidates, topK);
    }

    @Override
    public String describe() {
        return settings.endpoint();
    }

    private JsonNode chat(List<Map<String, String>> messages) {
        HttpUrl url = deploymentUrl(settings.rerankDeployment(), "chat/completions");
        return post(url, Map.of("temperature", 0, "messages", messages), "chat", settings.rerankDeployment());
    }

    private JsonNode post(HttpUrl url, Object payload, String modelType, String deployment) {
        long start = System.nanoTime();
        try {
            Request.Builder request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            credential.authorize(request);
            try (Response response = httpClient.newCall(request.build()).execute()) {
                ResponseBody body = response.body();
                String content = body == null ? "" : body.string();
                if (!response.isSuccessful()) {
                    throw new ProviderException("Azure OpenAI " + modelType + " deployment '" + deployment
                            + "' returned HTTP " + response.code() + ": " + abbreviate(content));
                }
                log.debug("Azure OpenAI {} call to '{}' took {} ms", modelType, deployment, (System.nanoTime() - start) / 1_000_000);
                return mapper.readTree(content);
            }
        } catch (IOException e) {
            throw new ProviderException("Error calling Azure OpenAI " + modelType + " deployment '" + deployment + "'", e);
        }
    }

    private HttpUrl deploymentUrl(String deployment, String operation) {
        return baseUrl.newBuilder()
                .addPathSegments("openai/deployments")
                .addPathSegment(deployment)
                .addPathSegments(operation)
                .addQueryParameter("api-version", settings.apiVersion())
                .build();
    }

    private String firstChoiceContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new ProviderException("Chat deployment '" + settings.rerankDeployment() + "' returned no message content");
        }
        return content.asText();
    }

    private static TokenUsage usage(JsonNode response) {
        JsonNode usage = response.path("usage");
        return new TokenUsage(
                usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0),
                usage.path("total_tokens").asLong(0));
    }

    private static Map<String, String> message(String role, String content) {
        return Map.of("role", role, "content", content);
    }

    private static String abbreviate(String value) {
        String flat = value.replaceAll("\\s+", " ").strip();
        return flat.length() > ERROR_BODY_LIMIT ? flat.substring(0, ERROR_BODY_LIMIT) + "..." : flat;
    }
}
