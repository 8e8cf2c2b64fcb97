package com.corpusindex.ingest;

import java.util.List;

import com.corpusindex.embed.EmbeddingFailure;

/**
 * Outcome of one indexing run. {@code chunksEmbedded} counts every chunk in the published payload,
 * including chunks whose vectors were reused from the previous version. {@code publishedVersion} is
 * null when nothing was published and the previous version stayed current.
 */
public record IndexingReport(
        int documentsTotal,
        int documentsSucceeded,
        int documentsPartial,
        int documentsFailed,
        int documentsReused,
        int chunksEmbedded,
        int chunksFailed,
        List<DocumentFailure> documentFailures,
        List<EmbeddingFailure> embeddingFailures,
        String publishedVersion) {

    public boolean published() {
        return publishedVersion != null;
    }
}
