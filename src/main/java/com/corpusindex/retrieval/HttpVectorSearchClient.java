package com.corpusindex.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.corpusindex.index.Restrict;
import com.corpusindex.index.StagedIndex;
import com.corpusindex.runtime.HttpCalls;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Vector-similarity service over HTTP. {@code POST /ingest} hands over the shard locations of a
 * staged version; {@code POST /query} returns {@code {"neighbors": [{"id", "score"}]}}.
 */
public class HttpVectorSearchClient implements VectorSearchClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final Duration ingestTimeout;

    public HttpVectorSearchClient(OkHttpClient httpClient, String endpoint, Duration ingestTimeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.ingestTimeout = ingestTimeout;
    }

    @Override
    public void ingest(StagedIndex staged) throws VectorSearchException, InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("indexVersion", staged.version().versionId());
        payload.put("shards", staged.shardPaths().stream().map(path -> path.toUri().toString()).toList());
        post("/ingest", payload, ingestTimeout);
    }

    @Override
    public List<Neighbor> findNeighbors(String indexVersion, float[] vector, int topK, List<Restrict> restricts, Duration timeout)
            throws VectorSearchException, InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("indexVersion", indexVersion);
        payload.put("vector", vector);
        payload.put("topK", topK);
        payload.put("restricts", restricts);
        JsonNode neighbors = post("/query", payload, timeout).path("neighbors");
        if (!neighbors.isArray()) {
            throw new VectorSearchException("vector search response has no neighbors array", false);
        }
        List<Neighbor> results = new ArrayList<>(neighbors.size());
        for (JsonNode neighbor : neighbors) {
            results.add(new Neighbor(neighbor.path("id").asText(), (float) neighbor.path("score").asDouble()));
        }
        return results;
    }

    private JsonNode post(String path, Map<String, Object> payload, Duration timeout)
            throws VectorSearchException, InterruptedException {
        Request request;
        try {
            request = new Request.Builder()
                    .url(endpoint + path)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new VectorSearchException("Unable to encode vector search request", false, e);
        }
        try (Response response = HttpCalls.await(httpClient.newCall(request), timeout)) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new VectorSearchException("vector search " + path + " returned HTTP " + response.code(),
                        HttpCalls.isRetryableStatus(response.code()));
            }
            String content = body.string();
            return content.isBlank() ? mapper.createObjectNode() : mapper.readTree(content);
        } catch (VectorSearchException e) {
            throw e;
        } catch (IOException e) {
            throw new VectorSearchException("vector search " + path + " failed: " + e.getMessage(), true, e);
        }
    }
}
