package com.corpusindex.retrieval;

/**
 * A vector-search hit whose id has no chunk-detail entry. The hit is dropped from the result.
 */
public record RetrievalIntegrityWarning(String chunkId, float score, String indexVersion, String message) {
}
