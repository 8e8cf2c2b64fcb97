package com.corpusindex.retrieval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.runtime.AppConfig;
import com.corpusindex.runtime.ConfigurationException;

public final class ChunkDetailRepositories {
    static final String FIXTURE_VERSION = "fixture";

    private ChunkDetailRepositories() {
    }

    public static ChunkDetailRepository fromConfig(AppConfig.RetrievalConfig config, IndexManifestStore store) throws IOException {
        String source = config.getChunkDetailSource() == null
                ? ""
                : config.getChunkDetailSource().trim().toLowerCase(Locale.ROOT);
        switch (source) {
            case "published":
                return new PublishedChunkDetailRepository(store);
            case "fixture":
                return InMemoryChunkDetailRepository.fromFile(Path.of(config.getFixturePath()), FIXTURE_VERSION);
            default:
                throw new ConfigurationException("Unknown retrieval.chunkDetailSource: " + config.getChunkDetailSource());
        }
    }
}
