package com.semsearch;

/**
 * @param vectorIndexCoverage percentage of records present in the vector index, 0-100
 * @param databaseSize size in bytes of the persisted store
 * @param endpoint provider endpoint or description
 */
public record StoreStats(
        int totalDocuments,
        int vectorCount,
        int vectorIndexCoverage,
        boolean hasVectorIndex,
        int vectorDimension,
        String databasePath,
        long databaseSize,
        String endpoint) {

    public boolean fullyCovered() {
        return vectorIndexCoverage >= 100;
    }

    static int coverage(int vectorCount, int totalDocuments) {
        if (totalDocuments <= 0) {
            return 0;
        }
        return (int) Math.round(vectorCount * 100.0 / totalDocuments);
    }
}
