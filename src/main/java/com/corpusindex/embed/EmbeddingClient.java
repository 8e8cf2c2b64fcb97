package com.corpusindex.embed;

import java.time.Duration;
import java.util.List;

/**
 * An embedding model reachable from this process. Implementations return one vector per input text,
 * in input order, and never accept more than {@link #maxBatchSize()} texts per call.
 */
public interface EmbeddingClient {
    List<float[]> embed(List<String> texts, Duration timeout) throws EmbeddingException, InterruptedException;

    int dimension();

    int maxBatchSize();

    default String version() {
        return "unversioned";
    }
}
