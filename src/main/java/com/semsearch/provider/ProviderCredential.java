package com.semsearch.provider;

import java.util.Objects;
import java.util.function.Supplier;

import okhttp3.Request;

/**
 * How requests to the model endpoint authenticate: a static API key, or a bearer token obtained from an identity
 * source (managed identity, workload identity, a CLI login). Chosen once when the provider is built.
 */
public final class ProviderCredential {

    public enum Kind {
        API_KEY,
        BEARER_TOKEN
    }

    private final Kind kind;
    private final String apiKey;
    private final Supplier<String> tokenSource;

    private ProviderCredential(Kind kind, String apiKey, Supplier<String> tokenSource) {
        this.kind = kind;
        this.apiKey = apiKey;
        this.tokenSource = tokenSource;
    }

    public static ProviderCredential apiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        return new ProviderCredential(Kind.API_KEY, apiKey, null);
    }

    public static ProviderCredential bearerToken(Supplier<String> tokenSource) {
        return new ProviderCredential(Kind.BEARER_TOKEN, null, Objects.requireNonNull(tokenSource, "tokenSource"));
    }

    public Kind kind() {
        return kind;
    }

    void authorize(Request.Builder request) {
        if (kind == Kind.API_KEY) {
            request.header("api-key", apiKey);
            return;
        }
        String token = tokenSource.get();
        if (token == null || token.isBlank()) {
            throw new ProviderException("Bearer token source returned no token");
        }
        request.header("Authorization", "Bearer " + token);
    }

    @Override
    public String toString() {
        return kind == Kind.API_KEY ? "API Key" : "Bearer token";
    }
}
