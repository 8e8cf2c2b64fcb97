package com.corpusindex.retrieval;

public record HydratedChunk(
        String chunkId,
        float score,
        String text,
        String documentName,
        int indexInDocument,
        int startOffset) {

    public String citation() {
        return documentName + "#" + indexInDocument;
    }
}
