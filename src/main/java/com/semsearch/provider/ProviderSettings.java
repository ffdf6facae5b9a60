package com.semsearch.provider;

/**
 * Resolved connection settings for {@link AzureOpenAiSemanticProvider}.
 */
public record ProviderSettings(
        String endpoint,
        String apiVersion,
        String embeddingDeployment,
        String rerankDeployment,
        String summarizationPrompt,
        String rerankPrompt) {
}
