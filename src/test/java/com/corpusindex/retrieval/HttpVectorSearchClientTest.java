package com.corpusindex.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.corpusindex.index.BuildInfo;
import com.corpusindex.index.IndexVersion;
import com.corpusindex.index.Restrict;
import com.corpusindex.index.StagedIndex;
import com.corpusindex.ingest.ChunkIdStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class HttpVectorSearchClientTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private OkHttpClient httpClient;

    @TempDir
    Path tempDir;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
        httpClient = new OkHttpClient();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
        httpClient.dispatcher().executorService().shutdown();
    }

    private HttpVectorSearchClient client() {
        return new HttpVectorSearchClient(httpClient, server.url("/vs/").toString(), Duration.ofSeconds(5));
    }

    @Test
    void shouldQueryWithVersionVectorAndRestricts() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"neighbors\": [{\"id\": \"c1\", \"score\": 0.91}, {\"id\": \"c2\", \"score\": 0.5}]}"));

        List<Neighbor> neighbors = client().findNeighbors("v1", new float[] { 0.5f, 0.5f }, 2,
                List.of(Restrict.sourceDocument("guide.md")), Duration.ofSeconds(2));

        assertEquals(List.of("c1", "c2"), neighbors.stream().map(Neighbor::id).toList());
        assertEquals(0.91f, neighbors.get(0).score(), 1e-6);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/vs/query", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("v1", body.path("indexVersion").asText());
        assertEquals(2, body.path("topK").asInt());
        assertEquals(2, body.path("vector").size());
        assertEquals("source_document", body.path("restricts").get(0).path("namespace").asText());
        assertEquals("guide.md", body.path("restricts").get(0).path("allow").get(0).asText());
    }

    @Test
    void shouldSendShardLocationsOnIngest() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));
        Path shard = tempDir.resolve("part-00000.jsonl");
        IndexVersion version = new IndexVersion("v2", Instant.EPOCH, List.of("versions/v2/embeddings/part-00000.jsonl"),
                "versions/v2/chunk-details.json", 1,
                new BuildInfo("m", 2, ChunkIdStrategy.CONTENT_DERIVED, "sig", Map.of()));

        client().ingest(new StagedIndex(version, tempDir, List.of(shard), tempDir.resolve("chunk-details.json")));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/vs/ingest", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("v2", body.path("indexVersion").asText());
        assertEquals(shard.toUri().toString(), body.path("shards").get(0).asText());
    }

    @Test
    void shouldClassifyFailures() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setBody("{\"results\": []}"));

        VectorSearchException serverError = assertThrows(VectorSearchException.class,
                () -> client().findNeighbors("v1", new float[] { 1f }, 1, List.of(), Duration.ofSeconds(2)));
        VectorSearchException notFound = assertThrows(VectorSearchException.class,
                () -> client().findNeighbors("v1", new float[] { 1f }, 1, List.of(), Duration.ofSeconds(2)));
        VectorSearchException malformed = assertThrows(VectorSearchException.class,
                () -> client().findNeighbors("v1", new float[] { 1f }, 1, List.of(), Duration.ofSeconds(2)));

        assertTrue(serverError.isRetryable());
        assertFalse(notFound.isRetryable());
        assertFalse(malformed.isRetryable());
    }
}
