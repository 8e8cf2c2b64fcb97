package com.corpusindex.index;

import java.util.Map;

import com.corpusindex.ingest.ChunkIdStrategy;

/**
 * How a version was produced. Vectors of an older version can be reused only when every field but
 * the fingerprints matches the current run.
 */
public record BuildInfo(
        String embeddingModelVersion,
        int dimension,
        ChunkIdStrategy chunkIdStrategy,
        String chunkingSignature,
        Map<String, String> documentFingerprints) {

    public boolean compatibleWith(BuildInfo other) {
        return embeddingModelVersion.equals(other.embeddingModelVersion())
                && dimension == other.dimension()
                && chunkIdStrategy == other.chunkIdStrategy()
                && chunkingSignature.equals(other.chunkingSignature());
    }
}
