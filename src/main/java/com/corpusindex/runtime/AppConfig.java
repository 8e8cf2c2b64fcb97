package com.corpusindex.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.corpusindex.ingest.ChunkIdStrategy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private DocumentsConfig documents = new DocumentsConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();
    private VectorSearchConfig vectorSearch = new VectorSearchConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();

    public static AppConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(path.toFile(), AppConfig.class);
        return config == null ? new AppConfig() : config;
    }

    public AppConfig validate() {
        if (chunking.getMaxSize() <= 0) {
            throw new ConfigurationException("chunking.maxSize must be positive but was " + chunking.getMaxSize());
        }
        if (chunking.getOverlap() < 0 || chunking.getOverlap() >= chunking.getMaxSize()) {
            throw new ConfigurationException("chunking.overlap must be in [0, maxSize) but was "
                    + chunking.getOverlap() + " with maxSize " + chunking.getMaxSize());
        }
        requirePositive("documents.parallelism", documents.getParallelism());
        requirePositive("embedding.dimension", embedding.getDimension());
        requirePositive("embedding.maxBatchSize", embedding.getMaxBatchSize());
        requirePositive("embedding.maxConcurrentRequests", embedding.getMaxConcurrentRequests());
        requirePositive("embedding.timeoutMs", embedding.getTimeoutMs());
        requirePositive("embedding.queryTimeoutMs", embedding.getQueryTimeoutMs());
        if (embedding.getMaxRetries() < 0) {
            throw new ConfigurationException("embedding.maxRetries must not be negative");
        }
        requireNotNegative("embedding.initialBackoffMs", embedding.getInitialBackoffMs());
        requireNotNegative("embedding.queryRetryBackoffMs", embedding.getQueryRetryBackoffMs());
        if (embedding.getMaxBackoffMs() < embedding.getInitialBackoffMs()) {
            throw new ConfigurationException("embedding.maxBackoffMs must be >= embedding.initialBackoffMs");
        }
        requirePositive("index.shardMaxBytes", index.getShardMaxBytes());
        requirePositive("vectorSearch.timeoutMs", vectorSearch.getTimeoutMs());
        requirePositive("retrieval.topK", retrieval.getTopK());
        requireEndpoint("embedding", embedding.getProvider(), "http", embedding.getEndpoint());
        requireEndpoint("vectorSearch", vectorSearch.getProvider(), "http", vectorSearch.getEndpoint());
        if ("fixture".equals(normalize(retrieval.getChunkDetailSource()))
                && (retrieval.getFixturePath() == null || retrieval.getFixturePath().isBlank())) {
            throw new ConfigurationException("retrieval.fixturePath is required when chunkDetailSource is fixture");
        }
        return this;
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive but was " + value);
        }
    }

    private static void requireNotNegative(String key, long value) {
        if (value < 0) {
            throw new ConfigurationException(key + " must not be negative but was " + value);
        }
    }

    private static void requireEndpoint(String section, String provider, String remoteProvider, String endpoint) {
        if (remoteProvider.equals(normalize(provider)) && (endpoint == null || endpoint.isBlank())) {
            throw new ConfigurationException(section + ".endpoint is required when provider is " + remoteProvider);
        }
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public DocumentsConfig getDocuments() {
        return documents;
    }

    public void setDocuments(DocumentsConfig documents) {
        this.documents = documents == null ? new DocumentsConfig() : documents;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public VectorSearchConfig getVectorSearch() {
        return vectorSearch;
    }

    public void setVectorSearch(VectorSearchConfig vectorSearch) {
        this.vectorSearch = vectorSearch == null ? new VectorSearchConfig() : vectorSearch;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxSize = 1000;
        private int overlap = 150;
        private ChunkIdStrategy idStrategy = ChunkIdStrategy.CONTENT_DERIVED;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public ChunkIdStrategy getIdStrategy() {
            return idStrategy;
        }

        public void setIdStrategy(ChunkIdStrategy idStrategy) {
            this.idStrategy = idStrategy == null ? ChunkIdStrategy.CONTENT_DERIVED : idStrategy;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DocumentsConfig {
        private String sourceDir = "data/rag_source_docs";
        private List<String> extensions = List.of(".md", ".txt", ".pdf");
        private int parallelism = 4;

        public String getSourceDir() {
            return sourceDir;
        }

        public void setSourceDir(String sourceDir) {
            this.sourceDir = sourceDir;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions == null ? List.of(".md", ".txt", ".pdf") : extensions;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private String endpoint;
        private String apiKey;
        private String model = "textembedding-gecko@003";
        private int dimension = 768;
        private int maxBatchSize = 5;
        private int maxConcurrentRequests = 2;
        private long timeoutMs = 30000;
        private long queryTimeoutMs = 5000;
        private int maxRetries = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 8000;
        private long queryRetryBackoffMs = 100;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public long getQueryRetryBackoffMs() {
            return queryRetryBackoffMs;
        }

        public void setQueryRetryBackoffMs(long queryRetryBackoffMs) {
            this.queryRetryBackoffMs = queryRetryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String root = ".corpusindex";
        private long shardMaxBytes = 64L * 1024 * 1024;
        private boolean incremental = true;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public long getShardMaxBytes() {
            return shardMaxBytes;
        }

        public void setShardMaxBytes(long shardMaxBytes) {
            this.shardMaxBytes = shardMaxBytes;
        }

        public boolean isIncremental() {
            return incremental;
        }

        public void setIncremental(boolean incremental) {
            this.incremental = incremental;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorSearchConfig {
        private String provider = "local";
        private String endpoint;
        private long timeoutMs = 3000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 3;
        private float scoreThreshold = 0.0f;
        private boolean dedupeByDocument = false;
        private String chunkDetailSource = "published";
        private String fixturePath;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public float getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(float scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public boolean isDedupeByDocument() {
            return dedupeByDocument;
        }

        public void setDedupeByDocument(boolean dedupeByDocument) {
            this.dedupeByDocument = dedupeByDocument;
        }

        public String getChunkDetailSource() {
            return chunkDetailSource;
        }

        public void setChunkDetailSource(String chunkDetailSource) {
            this.chunkDetailSource = chunkDetailSource;
        }

        public String getFixturePath() {
            return fixturePath;
        }

        public void setFixturePath(String fixturePath) {
            this.fixturePath = fixturePath;
        }
    }
}
