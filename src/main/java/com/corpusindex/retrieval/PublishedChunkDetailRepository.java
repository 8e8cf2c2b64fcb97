package com.corpusindex.retrieval;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.index.ChunkDetail;
import com.corpusindex.index.IndexFiles;
import com.corpusindex.index.IndexManifest;
import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.index.IndexVersion;

/**
 * Serves the chunk-detail map of whatever version the manifest currently names. The map is loaded
 * once per version and swapped when a newer version is published.
 */
public class PublishedChunkDetailRepository implements ChunkDetailRepository {
    private static final Logger log = LoggerFactory.getLogger(PublishedChunkDetailRepository.class);

    private final IndexManifestStore store;
    private final IndexFiles files = new IndexFiles();
    private volatile ChunkDetailSnapshot cached;

    public PublishedChunkDetailRepository(IndexManifestStore store) {
        this.store = store;
    }

    @Override
    public ChunkDetailSnapshot snapshot() throws IOException {
        IndexVersion current = store.load()
                .map(IndexManifest::current)
                .orElseThrow(() -> new IOException("No index has been published under " + store.root()));
        ChunkDetailSnapshot snapshot = cached;
        if (snapshot != null && snapshot.indexVersion().equals(current.versionId())) {
            return snapshot;
        }
        synchronized (this) {
            snapshot = cached;
            if (snapshot == null || !snapshot.indexVersion().equals(current.versionId())) {
                Map<String, ChunkDetail> details = files.readChunkDetails(store, current);
                snapshot = new ChunkDetailSnapshot(current.versionId(), details);
                cached = snapshot;
                log.info("chunk-details.loaded version={} entries={}", current.versionId(), snapshot.size());
            }
            return snapshot;
        }
    }

    @Override
    public void close() {
        cached = null;
    }
}
