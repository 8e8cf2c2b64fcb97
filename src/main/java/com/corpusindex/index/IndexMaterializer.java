package com.corpusindex.index;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.embed.EmbeddedChunk;
import com.corpusindex.ingest.Chunk;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns embedded chunks into a new index version: NDJSON ingestion shards plus the chunk-detail map,
 * both derived from the same input list so their ids always match. A version is written under a
 * fresh directory and becomes visible only when the manifest is swapped.
 */
public class IndexMaterializer {
    private static final Logger log = LoggerFactory.getLogger(IndexMaterializer.class);
    static final String SOURCE_DOCUMENT_NAMESPACE = "source_document";
    static final String CHUNK_INDEX_NAMESPACE = "chunk_index";
    static final String VERSIONS_DIR = "versions";
    static final String CHUNK_DETAIL_FILE = "chunk-details.json";
    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter
            .ofPattern("'v'yyyyMMdd'T'HHmmssSSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final IndexManifestStore store;
    private final long shardMaxBytes;
    private final Clock clock;
    private final IndexFiles files = new IndexFiles();
    private final ObjectMapper mapper = files.mapper();

    public IndexMaterializer(IndexManifestStore store, long shardMaxBytes) {
        this(store, shardMaxBytes, Clock.systemUTC());
    }

    public IndexMaterializer(IndexManifestStore store, long shardMaxBytes, Clock clock) {
        this.store = store;
        this.shardMaxBytes = shardMaxBytes;
        this.clock = clock;
    }

    public IndexManifest materialize(List<EmbeddedChunk> embedded, BuildInfo build) throws IndexPublishException {
        return publish(stage(embedded, build));
    }

    public StagedIndex stage(List<EmbeddedChunk> embedded, BuildInfo build) throws IndexPublishException {
        if (embedded.isEmpty()) {
            throw new IndexPublishException("Nothing to materialize: no embedded chunks");
        }
        Instant createdAt = clock.instant();
        String versionId = VERSION_FORMAT.format(createdAt) + "-" + UUID.randomUUID().toString().substring(0, 8);
        Path versionDir = store.root().resolve(VERSIONS_DIR).resolve(versionId);
        Path embeddingsDir = versionDir.resolve("embeddings");

        try {
            Files.createDirectories(embeddingsDir);
            Map<String, ChunkDetail> details = new LinkedHashMap<>();
            List<Path> shards = new ArrayList<>();
            BufferedWriter writer = null;
            long shardBytes = 0;
            try {
                for (EmbeddedChunk item : embedded) {
                    Chunk chunk = item.chunk();
                    if (details.containsKey(chunk.chunkId())) {
                        throw new IndexPublishException("Duplicate chunk id " + chunk.chunkId() + " in " + chunk.documentId());
                    }
                    EmbeddingRecord record = new EmbeddingRecord(
                            chunk.chunkId(),
                            item.vector(),
                            List.of(Restrict.sourceDocument(chunk.documentId()), Restrict.chunkIndex(chunk.indexInDocument())));
                    String line = mapper.writeValueAsString(record) + "\n";
                    long lineBytes = line.getBytes(StandardCharsets.UTF_8).length;
                    if (writer == null || (shardBytes > 0 && shardBytes + lineBytes > shardMaxBytes)) {
                        if (writer != null) {
                            writer.close();
                        }
                        Path shard = embeddingsDir.resolve("part-%05d.jsonl".formatted(shards.size()));
                        writer = Files.newBufferedWriter(shard, StandardCharsets.UTF_8,
                                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                        shards.add(shard);
                        shardBytes = 0;
                    }
                    writer.write(line);
                    shardBytes += lineBytes;
                    details.put(chunk.chunkId(), ChunkDetail.of(chunk));
                }
            } finally {
                if (writer != null) {
                    writer.close();
                }
            }

            Path detailPath = versionDir.resolve(CHUNK_DETAIL_FILE);
            mapper.writerWithDefaultPrettyPrinter().writeValue(detailPath.toFile(), details);

            IndexVersion version = new IndexVersion(
                    versionId,
                    createdAt,
                    shards.stream().map(store::relativize).toList(),
                    store.relativize(detailPath),
                    details.size(),
                    build);
            log.info("index.stage version={} records={} shards={}", versionId, details.size(), shards.size());
            return new StagedIndex(version, versionDir, List.copyOf(shards), detailPath);
        } catch (IndexPublishException e) {
            deleteVersionDir(versionDir);
            throw e;
        } catch (IOException e) {
            deleteVersionDir(versionDir);
            throw new IndexPublishException("Unable to write index version " + versionId, e);
        }
    }

    /**
     * Re-reads a staged version and checks that payload ids and chunk-detail keys are the same set.
     */
    public void verify(StagedIndex staged) throws IndexPublishException {
        IndexVersion version = staged.version();
        try {
            List<EmbeddingRecord> records = files.readRecords(staged.shardPaths());
            Map<String, ChunkDetail> details = files.readChunkDetails(staged.chunkDetailPath());
            Set<String> payloadIds = new HashSet<>();
            for (EmbeddingRecord record : records) {
                if (!payloadIds.add(record.id())) {
                    throw new IndexPublishException("Duplicate id " + record.id() + " in payload of " + version.versionId());
                }
                if (record.embedding().length != version.build().dimension()) {
                    throw new IndexPublishException("Record " + record.id() + " has dimension "
                            + record.embedding().length + ", expected " + version.build().dimension());
                }
            }
            if (!payloadIds.equals(details.keySet()) || payloadIds.size() != version.recordCount()) {
                throw new IndexPublishException("Payload ids (" + payloadIds.size() + ") and chunk-detail keys ("
                        + details.size() + ") differ in " + version.versionId());
            }
        } catch (IndexPublishException e) {
            throw e;
        } catch (IOException e) {
            throw new IndexPublishException("Unable to read back index version " + version.versionId(), e);
        }
    }

    /**
     * Verifies and publishes a staged version, then removes version directories the manifest no
     * longer names as current or previous.
     */
    public IndexManifest publish(StagedIndex staged) throws IndexPublishException {
        IndexManifest manifest;
        try {
            verify(staged);
            manifest = store.publish(staged.version());
        } catch (IndexPublishException e) {
            discard(staged);
            throw e;
        }
        pruneUnreferenced(manifest);
        return manifest;
    }

    public void discard(StagedIndex staged) {
        deleteVersionDir(staged.versionDir());
    }

    private void pruneUnreferenced(IndexManifest manifest) {
        Set<String> referenced = new HashSet<>();
        referenced.add(manifest.current().versionId());
        if (manifest.previous() != null) {
            referenced.add(manifest.previous().versionId());
        }
        Path versionsDir = store.root().resolve(VERSIONS_DIR);
        List<Path> stale;
        try (Stream<Path> entries = Files.list(versionsDir)) {
            stale = entries.filter(Files::isDirectory)
                    .filter(dir -> !referenced.contains(dir.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.warn("index.prune.failed dir={} reason={}", versionsDir, e.getMessage());
            return;
        }
        for (Path dir : stale) {
            deleteVersionDir(dir);
        }
        if (!stale.isEmpty()) {
            log.info("index.prune removed={} kept={}", stale.size(), referenced);
        }
    }

    private void deleteVersionDir(Path versionDir) {
        if (!Files.exists(versionDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(versionDir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("index.cleanup.failed dir={} reason={}", versionDir, e.getMessage());
        }
    }
}
