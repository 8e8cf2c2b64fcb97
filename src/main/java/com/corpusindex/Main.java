package com.corpusindex;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.embed.Embedder;
import com.corpusindex.embed.EmbeddingClients;
import com.corpusindex.index.IndexManifest;
import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.index.IndexVersion;
import com.corpusindex.index.Restrict;
import com.corpusindex.ingest.DocumentFailure;
import com.corpusindex.ingest.IndexingReport;
import com.corpusindex.ingest.IndexingService;
import com.corpusindex.retrieval.ChunkDetailRepositories;
import com.corpusindex.retrieval.ChunkDetailRepository;
import com.corpusindex.retrieval.ContextBundle;
import com.corpusindex.retrieval.RetrievalResult;
import com.corpusindex.retrieval.Retriever;
import com.corpusindex.retrieval.VectorSearchClient;
import com.corpusindex.retrieval.VectorSearchClients;
import com.corpusindex.runtime.AppConfig;
import com.corpusindex.runtime.ConfigurationException;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "corpus-index",
        mixinStandardHelpOptions = true,
        version = "corpus-index 0.1.0",
        description = "Builds versioned embedding indexes from a document corpus and retrieves citable context from them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--source-dir", description = "Directory of source documents; overrides documents.sourceDir")
    Path sourceDir;

    @Option(names = "--index-root", description = "Index directory; overrides index.root")
    Path indexRoot;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--top-k", description = "Results to return; defaults to retrieval.topK")
    Integer topK;

    @Option(names = "--score-threshold", description = "Minimum similarity score; defaults to retrieval.scoreThreshold")
    Float scoreThreshold;

    @Option(names = "--document", description = "Restrict retrieval to one source document name")
    String document;

    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        index,
        retrieve,
        rollback,
        status
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = AppConfig.load(Path.of(configPath)).validate();
        } catch (ConfigurationException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return 2;
        }
        IndexManifestStore store = new IndexManifestStore(indexRoot != null ? indexRoot : Path.of(config.getIndex().getRoot()));

        log.info("Starting corpus-index in {} mode", mode);
        log.info("Using config file: {} indexRoot={}", configPath, store.root());

        try {
            switch (mode) {
                case index:
                    return runIndex(config, store);
                case retrieve:
                    return runRetrieve(config, store);
                case rollback:
                    return runRollback(store);
                case status:
                default:
                    return runStatus(store);
            }
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 2;
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private int runIndex(AppConfig config, IndexManifestStore store) throws IOException, InterruptedException {
        Path documents = sourceDir != null ? sourceDir : Path.of(config.getDocuments().getSourceDir());
        VectorSearchClient vectorSearch = VectorSearchClients.fromConfig(config.getVectorSearch(), httpClient, store);
        try (Embedder embedder = Embedder.fromConfig(
                EmbeddingClients.fromConfig(config.getEmbedding(), httpClient),
                config.getEmbedding())) {
            IndexingReport report = IndexingService.fromConfig(config, documents, embedder, store, vectorSearch).run();
            for (DocumentFailure failure : report.documentFailures()) {
                log.warn("Document failed name={} stage={} reason={}", failure.documentName(), failure.stage(), failure.reason());
            }
            System.out.printf("documents=%d succeeded=%d partial=%d failed=%d reused=%d chunksEmbedded=%d chunksFailed=%d version=%s%n",
                    report.documentsTotal(),
                    report.documentsSucceeded(),
                    report.documentsPartial(),
                    report.documentsFailed(),
                    report.documentsReused(),
                    report.chunksEmbedded(),
                    report.chunksFailed(),
                    report.published() ? report.publishedVersion() : "none");
            return report.published() ? 0 : 1;
        }
    }

    private int runRetrieve(AppConfig config, IndexManifestStore store) throws IOException, InterruptedException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in retrieve mode");
            return 2;
        }
        int k = topK != null ? topK : config.getRetrieval().getTopK();
        if (k < 1) {
            log.error("--top-k must be at least 1");
            return 2;
        }
        float threshold = scoreThreshold != null ? scoreThreshold : config.getRetrieval().getScoreThreshold();
        List<Restrict> filters = document == null || document.isBlank()
                ? List.of()
                : List.of(Restrict.sourceDocument(document));

        VectorSearchClient vectorSearch = VectorSearchClients.fromConfig(config.getVectorSearch(), httpClient, store);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (Embedder embedder = Embedder.fromConfig(
                        EmbeddingClients.fromConfig(config.getEmbedding(), httpClient),
                        config.getEmbedding());
                ChunkDetailRepository chunkDetails = ChunkDetailRepositories.fromConfig(config.getRetrieval(), store)) {
            Retriever retriever = Retriever.fromConfig(embedder, vectorSearch, chunkDetails, config);
            Future<RetrievalResult> future = retriever.retrieveAsync(executor, query, k, threshold, filters);
            RetrievalResult result;
            try {
                result = future.get(retrievalDeadlineMs(config), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.error("retrieval.timeout deadlineMs={}", retrievalDeadlineMs(config));
                return 1;
            } catch (ExecutionException e) {
                log.error("retrieval.failed reason={}", e.getCause().getMessage());
                return 1;
            }
            ContextBundle bundle = ContextBundle.from(result);
            System.out.println("index version: " + bundle.indexVersion());
            System.out.print(bundle.render());
            if (!result.warnings().isEmpty()) {
                System.out.printf("%d hit(s) skipped: missing chunk details%n", result.warnings().size());
            }
            return 0;
        } finally {
            executor.shutdownNow();
        }
    }

    private int runRollback(IndexManifestStore store) {
        try {
            IndexManifest manifest = store.rollback();
            System.out.println("current version: " + manifest.current().versionId());
            return 0;
        } catch (IOException e) {
            log.error("Rollback failed: {}", e.getMessage());
            return 1;
        }
    }

    private int runStatus(IndexManifestStore store) throws IOException {
        Optional<IndexManifest> manifest = store.load();
        if (manifest.isEmpty()) {
            System.out.println("no published index under " + store.root());
            return 0;
        }
        printVersion("current", manifest.get().current());
        if (manifest.get().previous() != null) {
            printVersion("previous", manifest.get().previous());
        }
        return 0;
    }

    private static void printVersion(String label, IndexVersion version) {
        System.out.printf("%s: %s created=%s records=%d shards=%d model=%s dimension=%d%n",
                label,
                version.versionId(),
                version.createdAt(),
                version.recordCount(),
                version.shardLocations().size(),
                version.build().embeddingModelVersion(),
                version.build().dimension());
    }

    private static long retrievalDeadlineMs(AppConfig config) {
        // query embedding and search may each be attempted twice
        return 2 * (config.getEmbedding().getQueryTimeoutMs() + config.getVectorSearch().getTimeoutMs())
                + 2 * config.getEmbedding().getQueryRetryBackoffMs();
    }
}
