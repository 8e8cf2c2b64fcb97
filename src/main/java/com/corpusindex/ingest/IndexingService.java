package com.corpusindex.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.embed.BatchEmbeddingResult;
import com.corpusindex.embed.EmbeddedChunk;
import com.corpusindex.embed.Embedder;
import com.corpusindex.embed.EmbeddingFailure;
import com.corpusindex.index.BuildInfo;
import com.corpusindex.index.EmbeddingRecord;
import com.corpusindex.index.IndexFiles;
import com.corpusindex.index.IndexManifest;
import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.index.IndexMaterializer;
import com.corpusindex.index.IndexPublishException;
import com.corpusindex.index.IndexVersion;
import com.corpusindex.index.PublicationLock;
import com.corpusindex.index.StagedIndex;
import com.corpusindex.retrieval.VectorSearchClient;
import com.corpusindex.retrieval.VectorSearchException;
import com.corpusindex.runtime.AppConfig;

/**
 * Offline indexing run: load, chunk and embed every document, then stage, ingest and publish one new
 * index version. Document-level failures are collected into the report; only publication failures
 * abort the run.
 */
public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final DocumentLoader loader;
    private final Chunker chunker;
    private final Embedder embedder;
    private final IndexMaterializer materializer;
    private final IndexManifestStore store;
    private final VectorSearchClient vectorSearch;
    private final int documentParallelism;
    private final boolean incremental;
    private final IndexFiles files = new IndexFiles();

    public IndexingService(DocumentLoader loader,
            Chunker chunker,
            Embedder embedder,
            IndexMaterializer materializer,
            IndexManifestStore store,
            VectorSearchClient vectorSearch,
            int documentParallelism,
            boolean incremental) {
        this.loader = loader;
        this.chunker = chunker;
        this.embedder = embedder;
        this.materializer = materializer;
        this.store = store;
        this.vectorSearch = vectorSearch;
        this.documentParallelism = documentParallelism;
        this.incremental = incremental;
    }

    public static IndexingService fromConfig(AppConfig config,
            Path sourceDir,
            Embedder embedder,
            IndexManifestStore store,
            VectorSearchClient vectorSearch) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        return new IndexingService(
                new FileSystemDocumentLoader(sourceDir, config.getDocuments().getExtensions()),
                new Chunker(chunking.getMaxSize(), chunking.getOverlap(), chunking.getIdStrategy()),
                embedder,
                new IndexMaterializer(store, config.getIndex().getShardMaxBytes()),
                store,
                vectorSearch,
                config.getDocuments().getParallelism(),
                config.getIndex().isIncremental());
    }

    public IndexingReport run() throws IOException, InterruptedException {
        try (PublicationLock lock = PublicationLock.acquire(store.root())) {
            DocumentLoadResult loaded = loader.loadAll();
            PreviousIndex previous = incremental ? loadPrevious() : PreviousIndex.NONE;
            List<DocumentOutcome> outcomes = processAll(loaded.documents(), previous);

            List<DocumentFailure> documentFailures = new ArrayList<>(loaded.failures());
            List<EmbeddingFailure> embeddingFailures = new ArrayList<>();
            List<EmbeddedChunk> embedded = new ArrayList<>();
            Map<String, String> fingerprints = new LinkedHashMap<>();
            int succeeded = 0;
            int partial = 0;
            int failed = loaded.failures().size();
            int reused = 0;
            int chunksFailed = 0;
            for (DocumentOutcome outcome : outcomes) {
                embedded.addAll(outcome.embedded());
                embeddingFailures.addAll(outcome.embeddingFailures());
                chunksFailed += outcome.failedChunks();
                if (outcome.failure() != null) {
                    documentFailures.add(outcome.failure());
                    failed++;
                } else if (!outcome.embeddingFailures().isEmpty()) {
                    partial++;
                } else {
                    succeeded++;
                    fingerprints.put(outcome.documentName(), outcome.fingerprint());
                    if (outcome.reused()) {
                        reused++;
                    }
                }
            }

            String publishedVersion = null;
            if (embedded.isEmpty()) {
                log.warn("indexing.nothing-to-publish documents={} failed={}; previous version stays current",
                        outcomes.size() + loaded.failures().size(), failed);
            } else {
                BuildInfo build = buildInfo(fingerprints);
                publishedVersion = publish(embedded, build).current().versionId();
            }

            IndexingReport report = new IndexingReport(
                    outcomes.size() + loaded.failures().size(),
                    succeeded,
                    partial,
                    failed,
                    reused,
                    publishedVersion == null ? 0 : embedded.size(),
                    chunksFailed,
                    List.copyOf(documentFailures),
                    List.copyOf(embeddingFailures),
                    publishedVersion);
            log.info("indexing.done documents={} succeeded={} partial={} failed={} reused={} chunksEmbedded={} chunksFailed={} version={}",
                    report.documentsTotal(),
                    report.documentsSucceeded(),
                    report.documentsPartial(),
                    report.documentsFailed(),
                    report.documentsReused(),
                    report.chunksEmbedded(),
                    report.chunksFailed(),
                    publishedVersion == null ? "none" : publishedVersion);
            return report;
        }
    }

    private IndexManifest publish(List<EmbeddedChunk> embedded, BuildInfo build) throws IOException, InterruptedException {
        StagedIndex staged = materializer.stage(embedded, build);
        try {
            vectorSearch.ingest(staged);
        } catch (VectorSearchException e) {
            materializer.discard(staged);
            throw new IndexPublishException("Vector service did not ingest " + staged.version().versionId() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            materializer.discard(staged);
            throw e;
        }
        return materializer.publish(staged);
    }

    private List<DocumentOutcome> processAll(List<Document> documents, PreviousIndex previous) throws InterruptedException {
        if (documents.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(documentParallelism, documents.size()));
        try {
            List<Future<DocumentOutcome>> pending = new ArrayList<>(documents.size());
            for (Document document : documents) {
                pending.add(executor.submit(() -> process(document, previous)));
            }
            List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
            for (int i = 0; i < pending.size(); i++) {
                Document document = documents.get(i);
                try {
                    outcomes.add(pending.get(i).get());
                } catch (ExecutionException e) {
                    log.error("indexing.document.crashed name={}", document.name(), e.getCause());
                    outcomes.add(DocumentOutcome.failed(document.name(), DocumentFailure.Stage.CHUNK, String.valueOf(e.getCause())));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private DocumentOutcome process(Document document, PreviousIndex previous) throws InterruptedException {
        String fingerprint = Fingerprints.sha256(document.text());
        List<Chunk> chunks;
        try {
            chunks = chunker.chunk(document);
        } catch (RuntimeException e) {
            log.warn("indexing.chunk.failed name={} reason={}", document.name(), e.toString());
            return DocumentOutcome.failed(document.name(), DocumentFailure.Stage.CHUNK, e.toString());
        }
        if (chunks.isEmpty()) {
            return DocumentOutcome.failed(document.name(), DocumentFailure.Stage.CHUNK, "document produced no chunks");
        }

        Optional<List<EmbeddedChunk>> reused = previous.reuse(document.name(), fingerprint, chunks);
        if (reused.isPresent()) {
            log.debug("indexing.document.reused name={} chunks={}", document.name(), chunks.size());
            return new DocumentOutcome(document.name(), fingerprint, reused.get(), List.of(), 0, null, true);
        }

        BatchEmbeddingResult result = embedder.embedChunks(chunks);
        int failedChunks = result.failedChunkCount();
        log.debug("indexing.document.embedded name={} chunks={} failedChunks={}", document.name(), chunks.size(), failedChunks);
        DocumentFailure failure = result.embedded().isEmpty()
                ? new DocumentFailure(document.name(), DocumentFailure.Stage.EMBED, "all " + chunks.size() + " chunks failed to embed")
                : null;
        return new DocumentOutcome(document.name(), fingerprint, result.embedded(), result.failures(), failedChunks, failure, false);
    }

    private BuildInfo buildInfo(Map<String, String> fingerprints) {
        return new BuildInfo(
                embedder.client().version(),
                embedder.client().dimension(),
                chunker.idStrategy(),
                chunker.signature(),
                fingerprints);
    }

    private PreviousIndex loadPrevious() {
        if (chunker.idStrategy() != ChunkIdStrategy.CONTENT_DERIVED) {
            return PreviousIndex.NONE;
        }
        try {
            Optional<IndexVersion> current = store.load().map(IndexManifest::current);
            if (current.isEmpty() || !current.get().build().compatibleWith(buildInfo(Map.of()))) {
                return PreviousIndex.NONE;
            }
            Map<String, float[]> vectors = new HashMap<>();
            for (EmbeddingRecord record : files.readRecords(store, current.get())) {
                vectors.put(record.id(), record.embedding());
            }
            log.info("indexing.incremental previous={} vectors={}", current.get().versionId(), vectors.size());
            return new PreviousIndex(current.get().build().documentFingerprints(), vectors);
        } catch (IOException e) {
            log.warn("indexing.incremental.unavailable reason={}; every document will be embedded", e.getMessage());
            return PreviousIndex.NONE;
        }
    }

    private record PreviousIndex(Map<String, String> fingerprints, Map<String, float[]> vectorsById) {
        static final PreviousIndex NONE = new PreviousIndex(Map.of(), Map.of());

        Optional<List<EmbeddedChunk>> reuse(String documentName, String fingerprint, List<Chunk> chunks) {
            if (!fingerprint.equals(fingerprints.get(documentName))) {
                return Optional.empty();
            }
            List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
            for (Chunk chunk : chunks) {
                float[] vector = vectorsById.get(chunk.chunkId());
                if (vector == null) {
                    return Optional.empty();
                }
                embedded.add(new EmbeddedChunk(chunk, vector));
            }
            return Optional.of(embedded);
        }
    }

    private record DocumentOutcome(
            String documentName,
            String fingerprint,
            List<EmbeddedChunk> embedded,
            List<EmbeddingFailure> embeddingFailures,
            int failedChunks,
            DocumentFailure failure,
            boolean reused) {

        static DocumentOutcome failed(String documentName, DocumentFailure.Stage stage, String reason) {
            return new DocumentOutcome(documentName, null, List.of(), List.of(), 0,
                    new DocumentFailure(documentName, stage, reason), false);
        }
    }
}
