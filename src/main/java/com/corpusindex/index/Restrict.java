package com.corpusindex.index;

import java.util.List;

/**
 * A coarse filter label on an ingestion record: the record matches a query filter of the same
 * namespace when the two allow lists intersect.
 */
public record Restrict(String namespace, List<String> allow) {

    public static Restrict sourceDocument(String documentName) {
        return new Restrict(IndexMaterializer.SOURCE_DOCUMENT_NAMESPACE, List.of(documentName));
    }

    public static Restrict chunkIndex(int indexInDocument) {
        return new Restrict(IndexMaterializer.CHUNK_INDEX_NAMESPACE, List.of(String.valueOf(indexInDocument)));
    }
}
