package com.corpusindex.embed;

import java.util.Locale;

import com.corpusindex.runtime.AppConfig;
import com.corpusindex.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingClients {
    static final String API_KEY_ENV = "CORPUSINDEX_EMBEDDING_API_KEY";

    private EmbeddingClients() {
    }

    public static EmbeddingClient fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "" : config.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
                return new HashingEmbeddingClient(config.getDimension(), config.getMaxBatchSize());
            case "http":
                String apiKey = config.getApiKey();
                if (apiKey == null || apiKey.isBlank()) {
                    apiKey = System.getenv(API_KEY_ENV);
                }
                return new HttpEmbeddingClient(
                        httpClient,
                        config.getEndpoint(),
                        apiKey,
                        config.getModel(),
                        config.getDimension(),
                        config.getMaxBatchSize());
            default:
                throw new ConfigurationException("Unknown embedding.provider: " + config.getProvider());
        }
    }
}
