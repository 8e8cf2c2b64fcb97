package com.corpusindex.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.corpusindex.ingest.ChunkIdStrategy;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseDefaultsWhenFileIsMissing() throws Exception {
        AppConfig config = AppConfig.load(tempDir.resolve("absent.yml")).validate();

        assertEquals(1000, config.getChunking().getMaxSize());
        assertEquals(150, config.getChunking().getOverlap());
        assertEquals(ChunkIdStrategy.CONTENT_DERIVED, config.getChunking().getIdStrategy());
        assertEquals(5, config.getEmbedding().getMaxBatchSize());
        assertEquals(List.of(".md", ".txt", ".pdf"), config.getDocuments().getExtensions());
        assertEquals(3, config.getRetrieval().getTopK());
        assertEquals("local", config.getVectorSearch().getProvider());
        assertTrue(config.getIndex().isIncremental());
    }

    @Test
    void shouldBindYamlAndIgnoreUnknownKeys() throws Exception {
        Path file = tempDir.resolve("config.yml");
        Files.writeString(file, """
                chunking:
                  maxSize: 400
                  overlap: 40
                  idStrategy: RANDOM
                documents:
                  extensions: [".rst"]
                embedding:
                  provider: http
                  endpoint: http://localhost:9000/embed
                  maxBatchSize: 16
                retrieval:
                  topK: 7
                  dedupeByDocument: true
                legacy:
                  ignored: true
                """);

        AppConfig config = AppConfig.load(file).validate();

        assertEquals(400, config.getChunking().getMaxSize());
        assertEquals(ChunkIdStrategy.RANDOM, config.getChunking().getIdStrategy());
        assertEquals(List.of(".rst"), config.getDocuments().getExtensions());
        assertEquals(16, config.getEmbedding().getMaxBatchSize());
        assertEquals(7, config.getRetrieval().getTopK());
        assertTrue(config.getRetrieval().isDedupeByDocument());
        assertFalse(config.getRetrieval().getChunkDetailSource().isBlank());
    }

    @Test
    void shouldRejectInvalidSettings() {
        AppConfig overlapTooLarge = new AppConfig();
        overlapTooLarge.getChunking().setOverlap(1000);
        assertThrows(ConfigurationException.class, overlapTooLarge::validate);

        AppConfig zeroBatch = new AppConfig();
        zeroBatch.getEmbedding().setMaxBatchSize(0);
        assertThrows(ConfigurationException.class, zeroBatch::validate);

        AppConfig httpWithoutEndpoint = new AppConfig();
        httpWithoutEndpoint.getVectorSearch().setProvider("http");
        assertThrows(ConfigurationException.class, httpWithoutEndpoint::validate);

        AppConfig negativeQueryBackoff = new AppConfig();
        negativeQueryBackoff.getEmbedding().setQueryRetryBackoffMs(-1);
        assertThrows(ConfigurationException.class, negativeQueryBackoff::validate);

        AppConfig negativeBackoff = new AppConfig();
        negativeBackoff.getEmbedding().setInitialBackoffMs(-5);
        negativeBackoff.getEmbedding().setMaxBackoffMs(-1);
        assertThrows(ConfigurationException.class, negativeBackoff::validate);

        AppConfig fixtureWithoutPath = new AppConfig();
        fixtureWithoutPath.getRetrieval().setChunkDetailSource("fixture");
        assertThrows(ConfigurationException.class, fixtureWithoutPath::validate);
    }
}
