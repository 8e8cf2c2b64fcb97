package com.corpusindex.index;

import java.util.List;

/**
 * One line of the ingestion payload consumed by the vector-similarity service.
 */
public record EmbeddingRecord(String id, float[] embedding, List<Restrict> restricts) {
}
