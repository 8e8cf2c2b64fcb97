package com.corpusindex.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.index.EmbeddingRecord;
import com.corpusindex.index.IndexFiles;
import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.index.IndexVersion;
import com.corpusindex.index.Restrict;
import com.corpusindex.index.StagedIndex;

/**
 * In-process exact cosine search over the ingestion shards of a published version. Stands in for the
 * external vector-similarity service when none is configured.
 */
public class LocalVectorSearchService implements VectorSearchClient {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorSearchService.class);

    private final IndexManifestStore store;
    private final IndexFiles files = new IndexFiles();
    private volatile LoadedVersion loaded;

    public LocalVectorSearchService(IndexManifestStore store) {
        this.store = store;
    }

    @Override
    public void ingest(StagedIndex staged) {
        log.debug("vector-search.local.ingest version={} shards={}", staged.version().versionId(), staged.shardPaths().size());
    }

    @Override
    public List<Neighbor> findNeighbors(String indexVersion, float[] vector, int topK, List<Restrict> restricts, Duration timeout)
            throws VectorSearchException {
        List<EmbeddingRecord> records = records(indexVersion);
        return records.stream()
                .filter(record -> matches(record, restricts))
                .map(record -> new Neighbor(record.id(), cosine(vector, record.embedding())))
                .sorted(Comparator.comparing(Neighbor::score).reversed())
                .limit(topK)
                .toList();
    }

    private List<EmbeddingRecord> records(String indexVersion) throws VectorSearchException {
        LoadedVersion current = loaded;
        if (current != null && current.versionId().equals(indexVersion)) {
            return current.records();
        }
        synchronized (this) {
            current = loaded;
            if (current == null || !current.versionId().equals(indexVersion)) {
                try {
                    IndexVersion version = store.findVersion(indexVersion)
                            .orElseThrow(() -> new VectorSearchException("Unknown index version " + indexVersion, false));
                    current = new LoadedVersion(indexVersion, files.readRecords(store, version));
                } catch (VectorSearchException e) {
                    throw e;
                } catch (IOException e) {
                    throw new VectorSearchException("Unable to load index version " + indexVersion, false, e);
                }
                loaded = current;
                log.info("vector-search.local.loaded version={} records={}", indexVersion, current.records().size());
            }
            return current.records();
        }
    }

    static boolean matches(EmbeddingRecord record, List<Restrict> filters) {
        for (Restrict filter : filters) {
            boolean allowed = record.restricts() != null && record.restricts().stream()
                    .filter(restrict -> restrict.namespace().equals(filter.namespace()))
                    .anyMatch(restrict -> restrict.allow().stream().anyMatch(filter.allow()::contains));
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    private record LoadedVersion(String versionId, List<EmbeddingRecord> records) {
    }
}
