package com.corpusindex.ingest;

/**
 * A window of a document. {@code overlapLength} leading characters repeat the tail of the previous
 * chunk of the same document; the first chunk has none.
 */
public record Chunk(
        String chunkId,
        String documentId,
        String text,
        int indexInDocument,
        int startOffset,
        int length,
        int overlapLength) {
}
