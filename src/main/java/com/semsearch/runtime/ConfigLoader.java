package com.semsearch.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads the YAML configuration file, when present, then lets environment variables override provider and storage
 * settings.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_ENDPOINT = "AZURE_OPENAI_ENDPOINT";
    public static final String ENV_API_VERSION = "AZURE_OPENAI_API_VERSION";
    public static final String ENV_EMBED_DEPLOYMENT = "AZURE_OPENAI_EMBED_DEPLOYMENT";
    public static final String ENV_RERANK_DEPLOYMENT = "AZURE_OPENAI_RERANK_DEPLOYMENT";
    public static final String ENV_DEFAULT_DB = "SEMSEARCH_DEFAULT_DB";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load(Path configPath, Map<String, String> environment) throws IOException {
        AppConfig config = new AppConfig();
        if (configPath != null && Files.exists(configPath)) {
            log.debug("Reading configuration from {}", configPath);
            config = mapper.readValue(configPath.toFile(), AppConfig.class);
        }
        applyEnvironment(config, environment);
        return config;
    }

    void applyEnvironment(AppConfig config, Map<String, String> environment) {
        AppConfig.ProviderConfig provider = config.getProvider();
        override(environment, ENV_ENDPOINT, provider::setEndpoint);
        override(environment, ENV_API_VERSION, provider::setApiVersion);
        override(environment, ENV_EMBED_DEPLOYMENT, provider::setEmbeddingDeployment);
        override(environment, ENV_RERANK_DEPLOYMENT, provider::setRerankDeployment);
        override(environment, ENV_DEFAULT_DB, config.getStorage()::setPath);
    }

    private static void override(Map<String, String> environment, String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.strip());
        }
    }
}
