package com.corpusindex.retrieval;

import java.time.Duration;
import java.util.Locale;

import com.corpusindex.index.IndexManifestStore;
import com.corpusindex.runtime.AppConfig;
import com.corpusindex.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class VectorSearchClients {
    private static final Duration INGEST_TIMEOUT = Duration.ofMinutes(5);

    private VectorSearchClients() {
    }

    public static VectorSearchClient fromConfig(AppConfig.VectorSearchConfig config,
            OkHttpClient httpClient,
            IndexManifestStore store) {
        String provider = config.getProvider() == null ? "" : config.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "local":
                return new LocalVectorSearchService(store);
            case "http":
                return new HttpVectorSearchClient(httpClient, config.getEndpoint(), INGEST_TIMEOUT);
            default:
                throw new ConfigurationException("Unknown vectorSearch.provider: " + config.getProvider());
        }
    }
}
