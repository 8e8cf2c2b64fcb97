package com.corpusindex.embed;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic local embeddings from hashed tokens and character trigrams. Used for offline runs and
 * tests where no embedding service is reachable.
 */
public class HashingEmbeddingClient implements EmbeddingClient {
    private final int dimension;
    private final int maxBatchSize;

    public HashingEmbeddingClient(int dimension, int maxBatchSize) {
        this.dimension = dimension;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts, Duration timeout) throws EmbeddingException {
        if (texts.size() > maxBatchSize) {
            throw new EmbeddingException("batch of " + texts.size() + " exceeds limit " + maxBatchSize, false);
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
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
        return "hashing-v1-" + dimension;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        normalize(vector);
        return vector;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
