package com.semsearch.store;

public record ScoredFile(IndexedFile file, double similarity) {
}
