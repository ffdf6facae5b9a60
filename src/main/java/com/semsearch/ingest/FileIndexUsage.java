package com.semsearch.ingest;

import com.semsearch.provider.TokenUsage;

public record FileIndexUsage(TokenUsage summary, TokenUsage embedding) {
    public TokenUsage total() {
        return summary.plus(embedding);
    }
}
