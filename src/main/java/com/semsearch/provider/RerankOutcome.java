package com.semsearch.provider;

import java.util.List;

/**
 * Result of a rerank call, tagged with whether the provider answer was usable or a fallback ranking was substituted.
 */
public record RerankOutcome(Kind kind, List<RankedId> ranking, String fallbackReason) {

    public enum Kind {
        PARSED,
        FALLBACK_USED
    }

    public static RerankOutcome parsed(List<RankedId> ranking) {
        return new RerankOutcome(Kind.PARSED, List.copyOf(ranking), "");
    }

    public static RerankOutcome fallbackUsed(List<RankedId> ranking, String reason) {
        return new RerankOutcome(Kind.FALLBACK_USED, List.copyOf(ranking), reason == null ? "" : reason);
    }

    public boolean isFallback() {
        return kind == Kind.FALLBACK_USED;
    }
}
