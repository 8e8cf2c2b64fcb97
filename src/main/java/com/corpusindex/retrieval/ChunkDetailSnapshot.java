package com.corpusindex.retrieval;

import java.util.Map;
import java.util.Optional;

import com.corpusindex.index.ChunkDetail;

/**
 * The chunk-detail map of one index version. Immutable; a query uses one snapshot from start to end.
 */
public record ChunkDetailSnapshot(String indexVersion, Map<String, ChunkDetail> details) {

    public ChunkDetailSnapshot {
        details = Map.copyOf(details);
    }

    public Optional<ChunkDetail> find(String chunkId) {
        return Optional.ofNullable(details.get(chunkId));
    }

    public int size() {
        return details.size();
    }
}
