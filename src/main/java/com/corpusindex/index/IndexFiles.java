package com.corpusindex.index;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads the files of a written index version: NDJSON ingestion shards and the chunk-detail map.
 */
public class IndexFiles {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public List<EmbeddingRecord> readRecords(List<Path> shards) throws IOException {
        List<EmbeddingRecord> records = new ArrayList<>();
        for (Path shard : shards) {
            try (BufferedReader reader = Files.newBufferedReader(shard, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    records.add(mapper.readValue(line, EmbeddingRecord.class));
                }
            }
        }
        return records;
    }

    public Map<String, ChunkDetail> readChunkDetails(Path path) throws IOException {
        return mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, ChunkDetail>>() {
        });
    }

    public List<EmbeddingRecord> readRecords(IndexManifestStore store, IndexVersion version) throws IOException {
        return readRecords(version.shardLocations().stream().map(store::resolve).toList());
    }

    public Map<String, ChunkDetail> readChunkDetails(IndexManifestStore store, IndexVersion version) throws IOException {
        return readChunkDetails(store.resolve(version.chunkDetailLocation()));
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
