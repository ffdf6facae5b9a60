package com.semsearch.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.semsearch.ingest.FileTypes;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ProviderConfig provider = new ProviderConfig();
    private StorageConfig storage = new StorageConfig();
    private IndexingConfig indexing = new IndexingConfig();
    private SearchConfig search = new SearchConfig();
    private PromptsConfig prompts = new PromptsConfig();

    public ProviderConfig getProvider() {
        return provider;
    }

    public void setProvider(ProviderConfig provider) {
        this.provider = provider == null ? new ProviderConfig() : provider;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public PromptsConfig getPrompts() {
        return prompts;
    }

    public void setPrompts(PromptsConfig prompts) {
        this.prompts = prompts == null ? new PromptsConfig() : prompts;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String type = "azure-openai";
        private String endpoint = "";
        private String apiVersion = "2024-02-01";
        private String embeddingDeployment = "text-embedding-ada-002";
        private String rerankDeployment = "gpt-4.1-mini";
        private int timeoutMs = 60000;
        private int localDimension = 384;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public String getEmbeddingDeployment() {
            return embeddingDeployment;
        }

        public void setEmbeddingDeployment(String embeddingDeployment) {
            this.embeddingDeployment = embeddingDeployment;
        }

        public String getRerankDeployment() {
            return rerankDeployment;
        }

        public void setRerankDeployment(String rerankDeployment) {
            this.rerankDeployment = rerankDeployment;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getLocalDimension() {
            return localDimension;
        }

        public void setLocalDimension(int localDimension) {
            this.localDimension = localDimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String path = ".semsearch/index.json";
        private String vectorIndex = "flat";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getVectorIndex() {
            return vectorIndex;
        }

        public void setVectorIndex(String vectorIndex) {
            this.vectorIndex = vectorIndex;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private int concurrency = 3;
        private int maxChars = 50000;
        private List<String> extensions = new ArrayList<>(FileTypes.DEFAULT_EXTENSIONS);

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? new ArrayList<>() : extensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int topK = 5;
        private int candidateMultiplier = 3;
        private int minCandidates = 10;
        private double minSimilarity = 0.0;
        private double minScore = 0.0;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getCandidateMultiplier() {
            return candidateMultiplier;
        }

        public void setCandidateMultiplier(int candidateMultiplier) {
            this.candidateMultiplier = candidateMultiplier;
        }

        public int getMinCandidates() {
            return minCandidates;
        }

        public void setMinCandidates(int minCandidates) {
            this.minCandidates = minCandidates;
        }

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PromptsConfig {
        public static final String DEFAULT_SUMMARIZATION = """
                Please analyze the following text and provide a concise summary that captures the main concepts, \
                purpose, and key information. Focus on what this content is about and what someone searching for it \
                might be looking for.

                The summary should be:
                - 2-3 sentences maximum
                - Focused on the core concepts and purpose
                - Useful for semantic search matching
                - Written in a clear, descriptive style""";

        public static final String DEFAULT_RERANK = """
                You are helping to rerank search results based on relevance to a user query.

                Given a search query and a list of document summaries, rate each document's relevance to the query \
                on a scale of 0-100, where:
                - 100 = Highly relevant, directly answers or relates to the query
                - 80-99 = Very relevant, contains important related information
                - 60-79 = Moderately relevant, has some connection to the query
                - 40-59 = Somewhat relevant, tangentially related
                - 20-39 = Low relevance, minimal connection
                - 0-19 = Not relevant, unrelated to the query

                Consider semantic meaning, context, and intent - not just keyword matching.""";

        private String summarization = DEFAULT_SUMMARIZATION;
        private String rerank = DEFAULT_RERANK;

        public String getSummarization() {
            return summarization;
        }

        public void setSummarization(String summarization) {
            this.summarization = summarization == null || summarization.isBlank() ? DEFAULT_SUMMARIZATION : summarization;
        }

        public String getRerank() {
            return rerank;
        }

        public void setRerank(String rerank) {
            this.rerank = rerank == null || rerank.isBlank() ? DEFAULT_RERANK : rerank;
        }
    }
}
