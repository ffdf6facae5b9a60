package com.semsearch.provider;

public record TokenUsage(long prompt, long completion, long total) {
    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(prompt + other.prompt, completion + other.completion, total + other.total);
    }
}
