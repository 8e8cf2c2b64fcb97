package com.corpusindex.index;

import com.corpusindex.ingest.Chunk;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ChunkDetail(
        @JsonProperty("chunk_text") String chunkText,
        @JsonProperty("source_document_name") String sourceDocumentName,
        @JsonProperty("index_in_document") int indexInDocument,
        @JsonProperty("start_offset") int startOffset) {

    public static ChunkDetail of(Chunk chunk) {
        return new ChunkDetail(chunk.text(), chunk.documentId(), chunk.indexInDocument(), chunk.startOffset());
    }
}
