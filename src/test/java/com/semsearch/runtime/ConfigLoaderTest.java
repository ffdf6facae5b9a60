package com.semsearch.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void shouldReadYamlAndIgnoreUnknownKeys() throws Exception {
        Path config = Files.writeString(tempDir.resolve("semsearch.yml"), """
                provider:
                  type: local
                  localDimension: 128
                  somethingElse: true
                storage:
                  vectorIndex: bucketed
                indexing:
                  concurrency: 6
                  extensions: [md, adoc]
                search:
                  topK: 8
                  minScore: 55
                prompts:
                  rerank: Score these.
                """);

        AppConfig loaded = loader.load(config, Map.of());

        assertEquals("local", loaded.getProvider().getType());
        assertEquals(128, loaded.getProvider().getLocalDimension());
        assertEquals("bucketed", loaded.getStorage().getVectorIndex());
        assertEquals(".semsearch/index.json", loaded.getStorage().getPath());
        assertEquals(6, loaded.getIndexing().getConcurrency());
        assertEquals(List.of("md", "adoc"), loaded.getIndexing().getExtensions());
        assertEquals(8, loaded.getSearch().getTopK());
        assertEquals(55.0, loaded.getSearch().getMinScore());
        assertEquals("Score these.", loaded.getPrompts().getRerank());
        assertEquals(AppConfig.PromptsConfig.DEFAULT_SUMMARIZATION, loaded.getPrompts().getSummarization());
    }

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() throws Exception {
        AppConfig loaded = loader.load(tempDir.resolve("absent.yml"), Map.of());

        assertEquals("azure-openai", loaded.getProvider().getType());
        assertEquals("", loaded.getProvider().getEndpoint());
    }

    @Test
    void shouldLetEnvironmentOverrideFile() throws Exception {
        Path config = Files.writeString(tempDir.resolve("semsearch.yml"), """
                provider:
                  endpoint: https://from-file.openai.azure.com
                  rerankDeployment: file-chat
                """);

        AppConfig loaded = loader.load(config, Map.of(
                ConfigLoader.ENV_ENDPOINT, " https://from-env.openai.azure.com ",
                ConfigLoader.ENV_EMBED_DEPLOYMENT, "env-embed",
                ConfigLoader.ENV_API_VERSION, "",
                ConfigLoader.ENV_DEFAULT_DB, "/var/lib/semsearch/index.json"));

        assertEquals("https://from-env.openai.azure.com", loaded.getProvider().getEndpoint());
        assertEquals("env-embed", loaded.getProvider().getEmbeddingDeployment());
        assertEquals("file-chat", loaded.getProvider().getRerankDeployment());
        assertEquals("2024-02-01", loaded.getProvider().getApiVersion());
        assertEquals("/var/lib/semsearch/index.json", loaded.getStorage().getPath());
    }
}
