package com.semsearch.provider;

public record RerankCandidate(String id, String summary) {
}
