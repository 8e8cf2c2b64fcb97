package com.corpusindex.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.embed.Embedder;
import com.corpusindex.embed.EmbeddingException;
import com.corpusindex.index.ChunkDetail;
import com.corpusindex.index.Restrict;
import com.corpusindex.runtime.AppConfig;

/**
 * Query-time entry point: embeds the query, searches the vector service and hydrates the hits into
 * citable chunks. Holds no per-query state and may be shared by concurrent callers.
 */
public class Retriever {
    private static final Logger log = LoggerFactory.getLogger(Retriever.class);

    private final Embedder embedder;
    private final VectorSearchClient vectorSearch;
    private final ChunkDetailRepository chunkDetails;
    private final Duration searchTimeout;
    private final long fastRetryBackoffMs;
    private final boolean dedupeByDocument;

    public Retriever(Embedder embedder,
            VectorSearchClient vectorSearch,
            ChunkDetailRepository chunkDetails,
            Duration searchTimeout,
            long fastRetryBackoffMs,
            boolean dedupeByDocument) {
        this.embedder = embedder;
        this.vectorSearch = vectorSearch;
        this.chunkDetails = chunkDetails;
        this.searchTimeout = searchTimeout;
        this.fastRetryBackoffMs = fastRetryBackoffMs;
        this.dedupeByDocument = dedupeByDocument;
    }

    public static Retriever fromConfig(Embedder embedder,
            VectorSearchClient vectorSearch,
            ChunkDetailRepository chunkDetails,
            AppConfig config) {
        return new Retriever(
                embedder,
                vectorSearch,
                chunkDetails,
                Duration.ofMillis(config.getVectorSearch().getTimeoutMs()),
                config.getEmbedding().getQueryRetryBackoffMs(),
                config.getRetrieval().isDedupeByDocument());
    }

    public List<HydratedChunk> retrieve(String queryText, int topK, float scoreThreshold)
            throws RetrievalException, InterruptedException {
        return retrieveWithDiagnostics(queryText, topK, scoreThreshold, List.of()).chunks();
    }

    /**
     * Runs {@link #retrieveWithDiagnostics} on {@code executor}. Cancelling the returned future with
     * {@code mayInterruptIfRunning} cancels the in-flight service call.
     */
    public Future<RetrievalResult> retrieveAsync(ExecutorService executor,
            String queryText,
            int topK,
            float scoreThreshold,
            List<Restrict> filters) {
        return executor.submit(() -> retrieveWithDiagnostics(queryText, topK, scoreThreshold, filters));
    }

    public RetrievalResult retrieveWithDiagnostics(String queryText, int topK, float scoreThreshold, List<Restrict> filters)
            throws RetrievalException, InterruptedException {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query text must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1 but was " + topK);
        }

        ChunkDetailSnapshot snapshot;
        try {
            snapshot = chunkDetails.snapshot();
        } catch (IOException e) {
            throw new RetrievalException("Chunk details unavailable: " + e.getMessage(), e);
        }

        float[] queryVector;
        try {
            queryVector = embedder.embedQuery(queryText);
        } catch (EmbeddingException e) {
            throw new RetrievalException("Query embedding failed: " + e.getMessage(), e);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("retrieval cancelled before similarity search");
        }

        List<Neighbor> neighbors = search(snapshot.indexVersion(), queryVector, topK, filters);

        List<HydratedChunk> hydrated = new ArrayList<>();
        List<RetrievalIntegrityWarning> warnings = new ArrayList<>();
        Set<String> seenDocuments = new HashSet<>();
        List<Neighbor> ranked = neighbors.stream()
                .sorted(Comparator.comparing(Neighbor::score).reversed())
                .filter(neighbor -> neighbor.score() >= scoreThreshold)
                .toList();
        for (Neighbor neighbor : ranked) {
            if (hydrated.size() >= topK) {
                break;
            }
            Optional<ChunkDetail> detail = snapshot.find(neighbor.id());
            if (detail.isEmpty()) {
                RetrievalIntegrityWarning warning = new RetrievalIntegrityWarning(
                        neighbor.id(),
                        neighbor.score(),
                        snapshot.indexVersion(),
                        "vector search returned an id with no chunk-detail entry");
                log.warn("retrieval.integrity.missing-chunk id={} score={} version={}",
                        neighbor.id(), neighbor.score(), snapshot.indexVersion());
                warnings.add(warning);
                continue;
            }
            ChunkDetail found = detail.get();
            if (dedupeByDocument && !seenDocuments.add(found.sourceDocumentName())) {
                continue;
            }
            hydrated.add(new HydratedChunk(
                    neighbor.id(),
                    neighbor.score(),
                    found.chunkText(),
                    found.sourceDocumentName(),
                    found.indexInDocument(),
                    found.startOffset()));
        }
        log.info("retrieval.done version={} candidates={} returned={} warnings={}",
                snapshot.indexVersion(), neighbors.size(), hydrated.size(), warnings.size());
        return new RetrievalResult(snapshot.indexVersion(), List.copyOf(hydrated), List.copyOf(warnings));
    }

    private List<Neighbor> search(String indexVersion, float[] queryVector, int topK, List<Restrict> filters)
            throws RetrievalException, InterruptedException {
        try {
            return vectorSearch.findNeighbors(indexVersion, queryVector, topK, filters, searchTimeout);
        } catch (VectorSearchException first) {
            if (!first.isRetryable()) {
                throw new RetrievalException("Similarity search failed: " + first.getMessage(), first);
            }
            log.warn("retrieval.search.retry backoffMs={} reason={}", fastRetryBackoffMs, first.getMessage());
            Thread.sleep(fastRetryBackoffMs);
            try {
                return vectorSearch.findNeighbors(indexVersion, queryVector, topK, filters, searchTimeout);
            } catch (VectorSearchException second) {
                throw new RetrievalException("Similarity search failed after retry: " + second.getMessage(), second);
            }
        }
    }
}
