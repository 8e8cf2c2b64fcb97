package com.corpusindex.retrieval;

import java.time.Duration;
import java.util.List;

import com.corpusindex.index.Restrict;
import com.corpusindex.index.StagedIndex;

/**
 * The vector-similarity service. Versions are ingested before they are published so that a query
 * for the published version always finds its vectors.
 */
public interface VectorSearchClient {
    void ingest(StagedIndex staged) throws VectorSearchException, InterruptedException;

    /**
     * Nearest neighbors of {@code vector} within one index version, best first.
     */
    List<Neighbor> findNeighbors(String indexVersion, float[] vector, int topK, List<Restrict> restricts, Duration timeout)
            throws VectorSearchException, InterruptedException;
}
