package com.corpusindex.embed;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

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
 * Embedding service over HTTP: {@code POST {"model", "texts": [...]}} answered by
 * {@code {"embeddings": [[...], ...]}}.
 */
public class HttpEmbeddingClient implements EmbeddingClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final int maxBatchSize;

    public HttpEmbeddingClient(OkHttpClient httpClient,
            String endpoint,
            String apiKey,
            String model,
            int dimension,
            int maxBatchSize) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts, Duration timeout) throws EmbeddingException, InterruptedException {
        if (texts.size() > maxBatchSize) {
            throw new EmbeddingException("batch of " + texts.size() + " exceeds limit " + maxBatchSize, false);
        }
        Request request;
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", model);
            payload.put("texts", texts);
            Request.Builder builder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            request = builder.build();
        } catch (IOException e) {
            throw new EmbeddingException("Unable to encode embedding request", false, e);
        }

        try (Response response = HttpCalls.await(httpClient.newCall(request), timeout)) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingException("embedding service returned HTTP " + response.code(),
                        HttpCalls.isRetryableStatus(response.code()));
            }
            return parse(body.string(), texts.size());
        } catch (EmbeddingException e) {
            throw e;
        } catch (IOException e) {
            throw new EmbeddingException("embedding call failed: " + e.getMessage(), true, e);
        }
    }

    private List<float[]> parse(String json, int expected) throws EmbeddingException {
        JsonNode embeddings;
        try {
            embeddings = mapper.readTree(json).path("embeddings");
        } catch (IOException e) {
            throw new EmbeddingException("embedding response is not valid JSON", false, e);
        }
        if (!embeddings.isArray() || embeddings.size() != expected) {
            throw new EmbeddingException("expected " + expected + " embeddings but got "
                    + (embeddings.isArray() ? embeddings.size() : "none"), false);
        }
        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode vectorNode : embeddings) {
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public String version() {
        return "http-" + model;
    }
}
