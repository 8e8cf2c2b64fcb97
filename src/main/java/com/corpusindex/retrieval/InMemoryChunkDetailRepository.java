package com.corpusindex.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.corpusindex.index.ChunkDetail;
import com.corpusindex.index.IndexFiles;

/**
 * Fixture repository held in memory. Each instance is independent; {@link #close()} empties it.
 */
public class InMemoryChunkDetailRepository implements ChunkDetailRepository {
    private final String indexVersion;
    private final Map<String, ChunkDetail> details = new ConcurrentHashMap<>();

    public InMemoryChunkDetailRepository(String indexVersion) {
        this.indexVersion = indexVersion;
    }

    public static InMemoryChunkDetailRepository fromFile(Path fixture, String indexVersion) throws IOException {
        InMemoryChunkDetailRepository repository = new InMemoryChunkDetailRepository(indexVersion);
        repository.putAll(new IndexFiles().readChunkDetails(fixture));
        return repository;
    }

    public void put(String chunkId, ChunkDetail detail) {
        details.put(chunkId, detail);
    }

    public void putAll(Map<String, ChunkDetail> entries) {
        details.putAll(entries);
    }

    @Override
    public ChunkDetailSnapshot snapshot() {
        return new ChunkDetailSnapshot(indexVersion, details);
    }

    @Override
    public void close() {
        details.clear();
    }
}
