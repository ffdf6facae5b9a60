package com.semsearch.provider;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.semsearch.runtime.AppConfig;
import com.semsearch.runtime.ConfigurationException;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

public final class SemanticProviders {
    private static final Logger log = LoggerFactory.getLogger(SemanticProviders.class);

    public static final String ENV_API_KEY = "AZURE_OPENAI_API_KEY";
    public static final String ENV_AD_TOKEN = "AZURE_OPENAI_AD_TOKEN";

    private SemanticProviders() {
    }

    /**
     * Builds the provider named by {@code provider.type}. For {@code azure-openai} the endpoint must be set and a
     * credential must be resolvable from the environment.
     *
     * @throws ConfigurationException when the configuration cannot produce a working provider
     */
    public static SemanticProvider create(AppConfig config, Map<String, String> environment) {
        AppConfig.ProviderConfig provider = config.getProvider();
        String type = provider.getType() == null ? "" : provider.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "local":
                log.info("Using local semantic provider with {} dimensions", provider.getLocalDimension());
                return new LocalSemanticProvider(provider.getLocalDimension());
            case "azure-openai":
            case "":
                return azure(config, environment);
            default:
                throw new ConfigurationException("Unknown provider type '" + provider.getType() + "' (expected azure-openai or local)");
        }
    }

    static SemanticProvider azure(AppConfig config, Map<String, String> environment) {
        AppConfig.ProviderConfig provider = config.getProvider();
        if (provider.getEndpoint() == null || provider.getEndpoint().isBlank()) {
            throw new ConfigurationException("Azure OpenAI endpoint is required. Set AZURE_OPENAI_ENDPOINT or provider.endpoint.");
        }
        if (HttpUrl.parse(provider.getEndpoint().strip()) == null) {
            throw new ConfigurationException("Azure OpenAI endpoint '" + provider.getEndpoint()
                    + "' is not a valid http(s) URL");
        }
        ProviderCredential credential = resolveCredential(environment);
        log.info("Using Azure OpenAI at {} with {} authentication", provider.getEndpoint(), credential);

        Duration timeout = Duration.ofMillis(provider.getTimeoutMs());
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
        ProviderSettings settings = new ProviderSettings(
                provider.getEndpoint().strip(),
                provider.getApiVersion(),
                provider.getEmbeddingDeployment(),
                provider.getRerankDeployment(),
                config.getPrompts().getSummarization(),
                config.getPrompts().getRerank());
        return new AzureOpenAiSemanticProvider(httpClient, settings, credential);
    }

    static ProviderCredential resolveCredential(Map<String, String> environment) {
        String apiKey = environment.get(ENV_API_KEY);
        if (apiKey != null && !apiKey.isBlank()) {
            return ProviderCredential.apiKey(apiKey.strip());
        }
        String token = environment.get(ENV_AD_TOKEN);
        if (token != null && !token.isBlank()) {
            String resolved = token.strip();
            return ProviderCredential.bearerToken(() -> resolved);
        }
        throw new ConfigurationException("No credential found. Set " + ENV_API_KEY + " or " + ENV_AD_TOKEN + ".");
    }
}
